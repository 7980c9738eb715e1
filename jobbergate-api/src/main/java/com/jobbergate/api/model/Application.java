package com.jobbergate.api.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An application: the Python source, YAML configuration and Jinja2 templates
 * from which job scripts are rendered.
 *
 * The row is created first with metadata only; the files arrive later
 * through the upload endpoint and flip {@code applicationUploaded}.
 *
 * DB table: applications  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "applications")
public class Application {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "application_name", nullable = false)
    private String applicationName;

    // Optional human-friendly handle, unique when present.
    @Column(name = "application_identifier", unique = true)
    private String applicationIdentifier;

    @Column(name = "application_description")
    private String applicationDescription;

    @Column(name = "application_owner_email", nullable = false)
    private String applicationOwnerEmail;

    // jobbergate.py
    @Column(name = "application_file")
    private String applicationFile;

    // jobbergate.yaml
    @Column(name = "application_config")
    private String applicationConfig;

    // Template file name -> template source.
    @Convert(converter = JsonMapConverter.class)
    @Column(name = "application_templates", nullable = false)
    private Map<String, Object> applicationTemplates = new LinkedHashMap<>();

    @Column(name = "application_uploaded", nullable = false)
    private boolean applicationUploaded = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Application() {}   // required by JPA

    public Application(String applicationName, String applicationOwnerEmail) {
        this.applicationName       = applicationName;
        this.applicationOwnerEmail = applicationOwnerEmail;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public Long    getId()                     { return id; }
    public String  getApplicationName()        { return applicationName; }
    public String  getApplicationIdentifier()  { return applicationIdentifier; }
    public String  getApplicationDescription() { return applicationDescription; }
    public String  getApplicationOwnerEmail()  { return applicationOwnerEmail; }
    public String  getApplicationFile()        { return applicationFile; }
    public String  getApplicationConfig()      { return applicationConfig; }
    public boolean isApplicationUploaded()     { return applicationUploaded; }
    public Instant getCreatedAt()              { return createdAt; }
    public Instant getUpdatedAt()              { return updatedAt; }

    public Map<String, Object> getApplicationTemplates() { return applicationTemplates; }

    public void setApplicationName(String applicationName)               { this.applicationName = applicationName; }
    public void setApplicationIdentifier(String applicationIdentifier)   { this.applicationIdentifier = applicationIdentifier; }
    public void setApplicationDescription(String applicationDescription) { this.applicationDescription = applicationDescription; }
    public void setApplicationFile(String applicationFile)               { this.applicationFile = applicationFile; }
    public void setApplicationConfig(String applicationConfig)           { this.applicationConfig = applicationConfig; }
    public void setApplicationUploaded(boolean applicationUploaded)      { this.applicationUploaded = applicationUploaded; }

    public void setApplicationTemplates(Map<String, Object> applicationTemplates) {
        this.applicationTemplates = applicationTemplates == null
                ? new LinkedHashMap<>()
                : new LinkedHashMap<>(applicationTemplates);
    }
}
