package com.jobbergate.api.service;

import com.jobbergate.api.api.dto.ApplicationCreateRequest;
import com.jobbergate.api.api.dto.ApplicationUpdateRequest;
import com.jobbergate.api.files.ApplicationFixtures;
import com.jobbergate.api.files.FileValidationException;
import com.jobbergate.api.model.Application;
import com.jobbergate.api.pagination.ListResponseEnvelope;
import com.jobbergate.api.pagination.Pagination;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.io.ByteArrayInputStream;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ApplicationService against H2 with the Flyway schema.
 * Every test runs in a transaction that is rolled back afterwards.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@ActiveProfiles("test")
@Import({ApplicationService.class, ApplicationServiceTest.Metrics.class})
class ApplicationServiceTest {

    @TestConfiguration
    static class Metrics {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    private static final String OWNER = "owner@example.com";

    @Autowired ApplicationService service;
    @Autowired MeterRegistry      meterRegistry;

    // ------------------------------------------------------------------
    // create / get / count
    // ------------------------------------------------------------------

    @Test
    void create_thenGet_returnsTheSameRecord() {
        Application created = service.create(
                new ApplicationCreateRequest("test-app", "test-ident", "a description"), OWNER);

        Application fetched = service.get(created.getId());

        assertThat(fetched.getId()).isEqualTo(created.getId());
        assertThat(fetched.getApplicationName()).isEqualTo("test-app");
        assertThat(fetched.getApplicationIdentifier()).isEqualTo("test-ident");
        assertThat(fetched.getApplicationDescription()).isEqualTo("a description");
        assertThat(fetched.getApplicationOwnerEmail()).isEqualTo(OWNER);
        assertThat(fetched.isApplicationUploaded()).isFalse();
    }

    @Test
    void get_byIdentifierOrNumericKey() {
        Application created = service.create(new ApplicationCreateRequest("app", "friendly", null), OWNER);

        assertThat(service.get("friendly").getId()).isEqualTo(created.getId());
        assertThat(service.get(created.getId().toString()).getApplicationIdentifier()).isEqualTo("friendly");
    }

    @Test
    void get_unknownKey_throwsNotFound() {
        assertThatThrownBy(() -> service.get(999_999L)).isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> service.get("no-such-identifier")).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void get_digitsBeyondIdRange_fallBackToIdentifier() {
        Application created = service.create(
                new ApplicationCreateRequest("app", "99999999999999999999", null), OWNER);

        assertThat(service.get("99999999999999999999").getId()).isEqualTo(created.getId());
        assertThatThrownBy(() -> service.get("88888888888888888888"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void create_blankName_isRejected() {
        assertThatThrownBy(() -> service.create(new ApplicationCreateRequest(" ", null, null), OWNER))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("application_name");
    }

    @Test
    void count_tracksCreatesAndDeletes() {
        long before = service.count();
        Application a = service.create(new ApplicationCreateRequest("a", null, null), OWNER);
        service.create(new ApplicationCreateRequest("b", null, null), OWNER);
        assertThat(service.count()).isEqualTo(before + 2);

        service.delete(a.getId());
        assertThat(service.count()).isEqualTo(before + 1);
    }

    // ------------------------------------------------------------------
    // update / delete
    // ------------------------------------------------------------------

    @Test
    void update_changesOnlySuppliedFields() {
        Application created = service.create(
                new ApplicationCreateRequest("original", "ident", "old description"), OWNER);

        service.update(created.getId(), new ApplicationUpdateRequest(null, null, "new description"));

        Application fetched = service.get(created.getId());
        assertThat(fetched.getApplicationDescription()).isEqualTo("new description");
        assertThat(fetched.getApplicationName()).isEqualTo("original");
        assertThat(fetched.getApplicationIdentifier()).isEqualTo("ident");
    }

    @Test
    void update_unknownId_throwsNotFound() {
        assertThatThrownBy(() -> service.update(424242L, new ApplicationUpdateRequest("x", null, null)))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void delete_thenGet_isAbsent() {
        Application created = service.create(new ApplicationCreateRequest("doomed", null, null), OWNER);

        service.delete(created.getId());

        assertThatThrownBy(() -> service.get(created.getId())).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void delete_unknownId_throwsNotFound() {
        assertThatThrownBy(() -> service.delete(31337L)).isInstanceOf(ResourceNotFoundException.class);
    }

    // ------------------------------------------------------------------
    // list
    // ------------------------------------------------------------------

    @Test
    void list_withoutAll_hidesApplicationsWithoutIdentifier() {
        service.create(new ApplicationCreateRequest("anonymous", null, null), OWNER);
        service.create(new ApplicationCreateRequest("named", "named-ident", null), OWNER);

        ListResponseEnvelope<Application> hidden = service.list(
                new ListQuery(false, null, null, null, true), Pagination.none());
        ListResponseEnvelope<Application> everything = service.list(ListQuery.everything(), Pagination.none());

        assertThat(hidden.results()).extracting(Application::getApplicationName).containsExactly("named");
        assertThat(everything.results()).extracting(Application::getApplicationName)
                .containsExactly("anonymous", "named");
    }

    @Test
    void list_filtersByOwnerAndSearch() {
        service.create(new ApplicationCreateRequest("Slurm Array", null, null), OWNER);
        service.create(new ApplicationCreateRequest("gpu job", null, "uses SLURM too"), "other@example.com");
        service.create(new ApplicationCreateRequest("unrelated", null, null), OWNER);

        ListResponseEnvelope<Application> searched = service.list(
                new ListQuery(true, null, "slurm", null, true), Pagination.none());
        ListResponseEnvelope<Application> mine = service.list(
                new ListQuery(true, OWNER, "slurm", null, true), Pagination.none());

        assertThat(searched.results()).extracting(Application::getApplicationName)
                .containsExactly("Slurm Array", "gpu job");
        assertThat(mine.results()).extracting(Application::getApplicationName).containsExactly("Slurm Array");
    }

    @Test
    void list_searchTreatsLikeWildcardsAsLiterals() {
        service.create(new ApplicationCreateRequest("100% cpu", null, null), OWNER);
        service.create(new ApplicationCreateRequest("100 cpus", null, null), OWNER);
        service.create(new ApplicationCreateRequest("gpu_job", null, null), OWNER);
        service.create(new ApplicationCreateRequest("gpuxjob", null, null), OWNER);

        ListResponseEnvelope<Application> percent = service.list(
                new ListQuery(true, null, "0%", null, true), Pagination.none());
        ListResponseEnvelope<Application> underscore = service.list(
                new ListQuery(true, null, "u_j", null, true), Pagination.none());

        assertThat(percent.results()).extracting(Application::getApplicationName).containsExactly("100% cpu");
        assertThat(underscore.results()).extracting(Application::getApplicationName).containsExactly("gpu_job");
    }

    @Test
    void list_sortsByWhitelistedColumn() {
        service.create(new ApplicationCreateRequest("b", null, null), OWNER);
        service.create(new ApplicationCreateRequest("c", null, null), OWNER);
        service.create(new ApplicationCreateRequest("a", null, null), OWNER);

        ListResponseEnvelope<Application> descending = service.list(
                new ListQuery(true, null, null, "application_name", false), Pagination.none());

        assertThat(descending.results()).extracting(Application::getApplicationName).containsExactly("c", "b", "a");
    }

    @Test
    void list_unknownSortColumn_isRejected() {
        assertThatThrownBy(() -> service.list(
                new ListQuery(true, null, null, "application_file", true), Pagination.none()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid sorting column");
    }

    // ------------------------------------------------------------------
    // files
    // ------------------------------------------------------------------

    @Test
    void uploadFiles_storesFilesAndCountsThem() {
        Application created = service.create(new ApplicationCreateRequest("with-files", null, null), OWNER);
        byte[] archive = ApplicationFixtures.tarball(ApplicationFixtures.sampleEntries());

        service.uploadFiles(created.getId(), new ByteArrayInputStream(archive));

        Application fetched = service.get(created.getId());
        assertThat(fetched.isApplicationUploaded()).isTrue();
        assertThat(fetched.getApplicationFile()).isEqualTo(ApplicationFixtures.SOURCE);
        assertThat(fetched.getApplicationConfig()).isEqualTo(ApplicationFixtures.CONFIG);
        assertThat(fetched.getApplicationTemplates()).containsEntry("test_job_script.sh", ApplicationFixtures.TEMPLATE);
        assertThat(meterRegistry.counter("jobbergate.upload.files",
                "kind", "template", "status", "valid").count()).isGreaterThanOrEqualTo(1.0);
    }

    @Test
    void uploadFiles_invalidFile_rejectsEverythingAndNamesTheCulprits() {
        Application created = service.create(new ApplicationCreateRequest("broken", null, null), OWNER);
        Map<String, String> entries = new LinkedHashMap<>(ApplicationFixtures.sampleEntries());
        entries.put("jobbergate.py", "for i in range(10):\nprint(i)");
        entries.put("templates/broken.j2", "Hello {{ name }!");

        assertThatThrownBy(() -> service.uploadFiles(created.getId(),
                new ByteArrayInputStream(ApplicationFixtures.tarball(entries))))
                .isInstanceOfSatisfying(FileValidationException.class, e ->
                        assertThat(e.getInvalidFiles()).containsExactly("jobbergate.py", "templates/broken.j2"));

        assertThat(service.get(created.getId()).isApplicationUploaded()).isFalse();
    }

    @Test
    void clearFiles_resetsTheUpload() {
        Application created = service.create(new ApplicationCreateRequest("cleared", null, null), OWNER);
        service.uploadFiles(created.getId(),
                new ByteArrayInputStream(ApplicationFixtures.tarball(ApplicationFixtures.sampleEntries())));

        service.clearFiles(created.getId());

        Application fetched = service.get(created.getId());
        assertThat(fetched.isApplicationUploaded()).isFalse();
        assertThat(fetched.getApplicationFile()).isNull();
        assertThat(fetched.getApplicationTemplates()).isEmpty();
    }
}
