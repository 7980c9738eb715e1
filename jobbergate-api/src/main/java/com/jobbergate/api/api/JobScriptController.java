package com.jobbergate.api.api;

import com.jobbergate.api.api.dto.JobScriptCreateRequest;
import com.jobbergate.api.api.dto.JobScriptResponse;
import com.jobbergate.api.api.dto.JobScriptUpdateRequest;
import com.jobbergate.api.pagination.ListResponseEnvelope;
import com.jobbergate.api.pagination.Pagination;
import com.jobbergate.api.service.JobScriptService;
import com.jobbergate.api.service.ListQuery;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for job scripts.
 *
 * GET    /jobbergate/job-scripts        — list (filters, sorting, pagination)
 * GET    /jobbergate/job-scripts/{id}   — one job script
 * POST   /jobbergate/job-scripts        — create from files or render from an application
 * PUT    /jobbergate/job-scripts/{id}   — update supplied fields
 * DELETE /jobbergate/job-scripts/{id}   — delete
 */
@RestController
@RequestMapping("/jobbergate/job-scripts")
public class JobScriptController {

    private final JobScriptService jobScriptService;
    private final String           defaultOwner;
    private final int              defaultPerPage;

    public JobScriptController(JobScriptService jobScriptService,
                               @Value("${jobbergate.default-owner:anonymous@jobbergate.local}") String defaultOwner,
                               @Value("${jobbergate.pagination.default-per-page:10}") int defaultPerPage) {
        this.jobScriptService = jobScriptService;
        this.defaultOwner     = defaultOwner;
        this.defaultPerPage   = defaultPerPage;
    }

    @GetMapping
    public ListResponseEnvelope<JobScriptResponse> list(
            @RequestParam(defaultValue = "false") boolean user,
            @RequestParam(required = false) String search,
            @RequestParam(name = "sort_field", required = false) String sortField,
            @RequestParam(name = "sort_ascending", defaultValue = "true") boolean sortAscending,
            @RequestParam(name = "from_application_id", required = false) Long fromApplicationId,
            @RequestParam(required = false) Integer page,
            @RequestParam(name = "per_page", required = false) Integer perPage,
            @RequestHeader(name = ApiHeaders.OWNER, required = false) String owner) {
        ListQuery query = new ListQuery(true, user ? ownerOrDefault(owner) : null, search, sortField, sortAscending);
        return jobScriptService.list(query, fromApplicationId, Pagination.fromRequest(page, perPage, defaultPerPage))
                .map(JobScriptResponse::from);
    }

    @GetMapping("/{id}")
    public JobScriptResponse get(@PathVariable Long id) {
        return JobScriptResponse.from(jobScriptService.get(id));
    }

    /**
     * Example (render from application 3):
     *   curl -X POST http://localhost:8000/jobbergate/job-scripts \
     *     -H "Content-Type: application/json" \
     *     -d '{"job_script_name":"rats","application_id":3,"param_dict":{"job_name":"rats"}}'
     */
    @PostMapping
    public ResponseEntity<JobScriptResponse> create(
            @RequestBody JobScriptCreateRequest req,
            @RequestHeader(name = ApiHeaders.OWNER, required = false) String owner) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(JobScriptResponse.from(jobScriptService.create(req, ownerOrDefault(owner))));
    }

    @PutMapping("/{id}")
    public JobScriptResponse update(@PathVariable Long id, @RequestBody JobScriptUpdateRequest req) {
        return JobScriptResponse.from(jobScriptService.update(id, req));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        jobScriptService.delete(id);
        return ResponseEntity.noContent().build();
    }

    private String ownerOrDefault(String owner) {
        return owner == null || owner.isBlank() ? defaultOwner : owner;
    }
}
