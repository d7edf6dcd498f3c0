package com.labtrace.lims.api.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.JoinTable;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Named bundle of test definitions applied to a sample in one go.
 */
@Entity
@Table(name = "test_pack")
public class TestPack extends AbstractAuditingEntity<UUID> implements Serializable {

    private static final long serialVersionUID = 1L;

    @Id
    @GeneratedValue
    @Column(name = "id", columnDefinition = "uuid")
    private UUID id;

    @Column(name = "name", nullable = false, unique = true, length = 255)
    private String name;

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
        name = "test_pack_item",
        joinColumns = @JoinColumn(name = "test_pack_id"),
        inverseJoinColumns = @JoinColumn(name = "test_definition_id")
    )
    @OrderColumn(name = "position")
    private List<TestDefinition> definitions = new ArrayList<>();

    @Override
    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<TestDefinition> getDefinitions() {
        return definitions;
    }

    public void setDefinitions(List<TestDefinition> definitions) {
        this.definitions = definitions;
    }
}
