package com.jobbergate.api.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A reusable set of template variables that can be fed to an application
 * when rendering job scripts.
 *
 * DB table: smart_templates  (created by Flyway V3 migration)
 */
@Entity
@Table(name = "smart_templates")
public class SmartTemplate {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(unique = true)
    private String identifier;

    @Column
    private String description;

    @Column(name = "owner_email", nullable = false)
    private String ownerEmail;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "template_vars", nullable = false)
    private Map<String, Object> templateVars = new LinkedHashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected SmartTemplate() {}   // required by JPA

    public SmartTemplate(String name, String ownerEmail) {
        this.name       = name;
        this.ownerEmail = ownerEmail;
    }

    public Long    getId()          { return id; }
    public String  getName()        { return name; }
    public String  getIdentifier()  { return identifier; }
    public String  getDescription() { return description; }
    public String  getOwnerEmail()  { return ownerEmail; }
    public Instant getCreatedAt()   { return createdAt; }
    public Instant getUpdatedAt()   { return updatedAt; }

    public Map<String, Object> getTemplateVars() { return templateVars; }

    public void setName(String name)               { this.name = name; }
    public void setIdentifier(String identifier)   { this.identifier = identifier; }
    public void setDescription(String description) { this.description = description; }

    public void setTemplateVars(Map<String, Object> templateVars) {
        this.templateVars = templateVars == null
                ? new LinkedHashMap<>()
                : new LinkedHashMap<>(templateVars);
    }
}
