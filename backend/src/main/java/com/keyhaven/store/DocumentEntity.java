package com.keyhaven.store;

import java.time.Instant;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

@Table("documents")
public class DocumentEntity {

    @PrimaryKey
    private DocumentKey key;

    /** Document fields as a JSON object. */
    @Column("body")
    private String body;

    @Column("updated_at")
    private Instant updatedAt;

    public DocumentEntity() {}

    public DocumentEntity(DocumentKey key, String body, Instant updatedAt) {
        this.key = key;
        this.body = body;
        this.updatedAt = updatedAt;
    }

    // Getters & Setters
    public DocumentKey getKey() { return key; }
    public void setKey(DocumentKey key) { this.key = key; }
    public String getBody() { return body; }
    public void setBody(String body) { this.body = body; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
