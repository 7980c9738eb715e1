package com.jobbergate.api.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A job script: a set of rendered files ready to be submitted to a cluster.
 *
 * Usually rendered from an {@link Application}'s templates, but the link is
 * informational only. Deleting the application nulls {@code applicationId}
 * and keeps the script.
 *
 * DB table: job_scripts  (created by Flyway V2 migration)
 */
@Entity
@Table(name = "job_scripts")
public class JobScript {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_script_name", nullable = false)
    private String jobScriptName;

    @Column(name = "job_script_description")
    private String jobScriptDescription;

    @Column(name = "job_script_owner_email", nullable = false)
    private String jobScriptOwnerEmail;

    @Column(name = "application_id")
    private Long applicationId;

    // Key into jobScriptFiles of the file that gets submitted.
    @Column(name = "job_script_main_file")
    private String jobScriptMainFile;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "job_script_files", nullable = false)
    private Map<String, Object> jobScriptFiles = new LinkedHashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected JobScript() {}   // required by JPA

    public JobScript(String jobScriptName, String jobScriptOwnerEmail) {
        this.jobScriptName       = jobScriptName;
        this.jobScriptOwnerEmail = jobScriptOwnerEmail;
    }

    public Long    getId()                   { return id; }
    public String  getJobScriptName()        { return jobScriptName; }
    public String  getJobScriptDescription() { return jobScriptDescription; }
    public String  getJobScriptOwnerEmail()  { return jobScriptOwnerEmail; }
    public Long    getApplicationId()        { return applicationId; }
    public String  getJobScriptMainFile()    { return jobScriptMainFile; }
    public Instant getCreatedAt()            { return createdAt; }
    public Instant getUpdatedAt()            { return updatedAt; }

    public Map<String, Object> getJobScriptFiles() { return jobScriptFiles; }

    public void setJobScriptName(String jobScriptName)               { this.jobScriptName = jobScriptName; }
    public void setJobScriptDescription(String jobScriptDescription) { this.jobScriptDescription = jobScriptDescription; }
    public void setApplicationId(Long applicationId)                 { this.applicationId = applicationId; }
    public void setJobScriptMainFile(String jobScriptMainFile)       { this.jobScriptMainFile = jobScriptMainFile; }

    public void setJobScriptFiles(Map<String, Object> jobScriptFiles) {
        this.jobScriptFiles = jobScriptFiles == null
                ? new LinkedHashMap<>()
                : new LinkedHashMap<>(jobScriptFiles);
    }
}
