package com.jobbergate.api.api;

import com.jobbergate.api.api.dto.ApplicationCreateRequest;
import com.jobbergate.api.api.dto.ApplicationResponse;
import com.jobbergate.api.api.dto.ApplicationUpdateRequest;
import com.jobbergate.api.files.FileValidationException;
import com.jobbergate.api.pagination.ListResponseEnvelope;
import com.jobbergate.api.pagination.Pagination;
import com.jobbergate.api.service.ApplicationService;
import com.jobbergate.api.service.ListQuery;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;

/**
 * REST API for applications.
 *
 * GET    /jobbergate/applications                     — list (filters, sorting, pagination)
 * GET    /jobbergate/applications/{id_or_identifier}  — one application
 * POST   /jobbergate/applications                     — create (metadata only)
 * PUT    /jobbergate/applications/{id}                — update supplied fields
 * DELETE /jobbergate/applications/{id}                — delete
 * POST   /jobbergate/applications/{id}/upload         — attach files from a gzip tarball
 * DELETE /jobbergate/applications/{id}/upload         — detach files
 */
@RestController
@RequestMapping("/jobbergate/applications")
public class ApplicationController {

    private final ApplicationService applicationService;
    private final String             defaultOwner;
    private final int                defaultPerPage;

    public ApplicationController(ApplicationService applicationService,
                                 @Value("${jobbergate.default-owner:anonymous@jobbergate.local}") String defaultOwner,
                                 @Value("${jobbergate.pagination.default-per-page:10}") int defaultPerPage) {
        this.applicationService = applicationService;
        this.defaultOwner       = defaultOwner;
        this.defaultPerPage     = defaultPerPage;
    }

    /**
     * List applications. Without {@code all=true} only applications that have
     * an identifier are returned.
     *
     * Example:
     *   curl 'http://localhost:8000/jobbergate/applications?all=true&page=0&per_page=5'
     */
    @GetMapping
    public ListResponseEnvelope<ApplicationResponse> list(
            @RequestParam(defaultValue = "false") boolean all,
            @RequestParam(defaultValue = "false") boolean user,
            @RequestParam(required = false) String search,
            @RequestParam(name = "sort_field", required = false) String sortField,
            @RequestParam(name = "sort_ascending", defaultValue = "true") boolean sortAscending,
            @RequestParam(required = false) Integer page,
            @RequestParam(name = "per_page", required = false) Integer perPage,
            @RequestHeader(name = ApiHeaders.OWNER, required = false) String owner) {
        ListQuery query = new ListQuery(all, user ? ownerOrDefault(owner) : null, search, sortField, sortAscending);
        return applicationService.list(query, Pagination.fromRequest(page, perPage, defaultPerPage))
                .map(ApplicationResponse::from);
    }

    @GetMapping("/{idOrIdentifier}")
    public ApplicationResponse get(@PathVariable String idOrIdentifier) {
        return ApplicationResponse.from(applicationService.get(idOrIdentifier));
    }

    @PostMapping
    public ResponseEntity<ApplicationResponse> create(
            @RequestBody ApplicationCreateRequest req,
            @RequestHeader(name = ApiHeaders.OWNER, required = false) String owner) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApplicationResponse.from(applicationService.create(req, ownerOrDefault(owner))));
    }

    @PutMapping("/{id}")
    public ApplicationResponse update(@PathVariable Long id, @RequestBody ApplicationUpdateRequest req) {
        return ApplicationResponse.from(applicationService.update(id, req));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        applicationService.delete(id);
        return ResponseEntity.noContent().build();
    }

    /**
     * Upload the application's files as a gzip tarball in the multipart field
     * {@code upload_file}. HTTP 422 when a file fails its syntax check.
     */
    @PostMapping(path = "/{id}/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApplicationResponse> upload(@PathVariable Long id,
                                                      @RequestParam("upload_file") MultipartFile uploadFile) {
        try (InputStream in = uploadFile.getInputStream()) {
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(ApplicationResponse.from(applicationService.uploadFiles(id, in)));
        } catch (IOException e) {
            throw new FileValidationException("Could not read the uploaded file", e);
        }
    }

    @DeleteMapping("/{id}/upload")
    public ResponseEntity<Void> deleteUpload(@PathVariable Long id) {
        applicationService.clearFiles(id);
        return ResponseEntity.noContent().build();
    }

    private String ownerOrDefault(String owner) {
        return owner == null || owner.isBlank() ? defaultOwner : owner;
    }
}
