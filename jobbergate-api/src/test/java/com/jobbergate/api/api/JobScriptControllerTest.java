package com.jobbergate.api.api;

import com.jobbergate.api.api.dto.JobScriptCreateRequest;
import com.jobbergate.api.model.JobScript;
import com.jobbergate.api.pagination.ListResponseEnvelope;
import com.jobbergate.api.pagination.Pagination;
import com.jobbergate.api.pagination.ResponseMetadata;
import com.jobbergate.api.service.JobScriptRenderException;
import com.jobbergate.api.service.JobScriptService;
import com.jobbergate.api.service.ListQuery;
import com.jobbergate.api.service.ResourceNotFoundException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(JobScriptController.class)
class JobScriptControllerTest {

    @Autowired MockMvc            mockMvc;
    @MockitoBean JobScriptService jobScriptService;

    @Test
    void create_fromApplication_bindsSnakeCaseFields() throws Exception {
        when(jobScriptService.create(any(), eq("me@example.com"))).thenReturn(fakeJobScript(1L, 3L));

        mockMvc.perform(post("/jobbergate/job-scripts")
                        .header(ApiHeaders.OWNER, "me@example.com")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"job_script_name":"rats","application_id":3,"param_dict":{"job_name":"rats"}}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(1))
                .andExpect(jsonPath("$.application_id").value(3))
                .andExpect(jsonPath("$.job_script_main_file").value("run.sh"))
                .andExpect(jsonPath("$.job_script_files['run.sh']").value("#!/bin/bash\n"));

        ArgumentCaptor<JobScriptCreateRequest> captor = ArgumentCaptor.forClass(JobScriptCreateRequest.class);
        verify(jobScriptService).create(captor.capture(), eq("me@example.com"));
        assertThat(captor.getValue().jobScriptName()).isEqualTo("rats");
        assertThat(captor.getValue().applicationId()).isEqualTo(3L);
        assertThat(captor.getValue().paramDict()).containsEntry("job_name", "rats");
    }

    @Test
    void create_renderFailure_returns422() throws Exception {
        when(jobScriptService.create(any(), any()))
                .thenThrow(new JobScriptRenderException("Application 3 has no uploaded templates to render"));

        mockMvc.perform(post("/jobbergate/job-scripts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"job_script_name":"rats","application_id":3}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.title").value("Render failed"));
    }

    @Test
    void get_unknown_returns404() throws Exception {
        when(jobScriptService.get(42L)).thenThrow(new ResourceNotFoundException("JobScript", 42L));

        mockMvc.perform(get("/jobbergate/job-scripts/{id}", 42))
                .andExpect(status().isNotFound());
    }

    @Test
    void list_fromApplication_filtersAndIgnoresIdentifierRule() throws Exception {
        when(jobScriptService.list(eq(new ListQuery(true, null, null, null, true)), eq(3L), eq(Pagination.none())))
                .thenReturn(new ListResponseEnvelope<>(List.of(fakeJobScript(1L, 3L)), new ResponseMetadata(1, null, null)));

        mockMvc.perform(get("/jobbergate/job-scripts").param("from_application_id", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results[0].job_script_name").value("rats"))
                .andExpect(jsonPath("$.metadata.total").value(1));
    }

    @Test
    void list_pageWithoutPerPage_usesDefaultPerPage() throws Exception {
        when(jobScriptService.list(any(), any(), eq(new Pagination(2, 10))))
                .thenReturn(new ListResponseEnvelope<>(List.of(), new ResponseMetadata(0, 2, 10)));

        mockMvc.perform(get("/jobbergate/job-scripts").param("page", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metadata.per_page").value(10));
    }

    @Test
    void update_badMainFile_returns422() throws Exception {
        when(jobScriptService.update(eq(1L), any()))
                .thenThrow(new IllegalArgumentException("job_script_main_file 'x' is not one of the job script files"));

        mockMvc.perform(put("/jobbergate/job-scripts/{id}", 1)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"job_script_main_file":"x"}
                                """))
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void delete_returns204() throws Exception {
        mockMvc.perform(delete("/jobbergate/job-scripts/{id}", 1))
                .andExpect(status().isNoContent());

        verify(jobScriptService).delete(1L);
    }

    private static JobScript fakeJobScript(Long id, Long applicationId) {
        JobScript jobScript = new JobScript("rats", "me@example.com");
        jobScript.setApplicationId(applicationId);
        Map<String, Object> files = new LinkedHashMap<>();
        files.put("run.sh", "#!/bin/bash\n");
        jobScript.setJobScriptFiles(files);
        jobScript.setJobScriptMainFile("run.sh");
        try {
            var f = jobScript.getClass().getDeclaredField("id");
            f.setAccessible(true);
            f.set(jobScript, id);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
        return jobScript;
    }
}
