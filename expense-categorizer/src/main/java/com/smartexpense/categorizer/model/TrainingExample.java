package com.smartexpense.categorizer.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Audit row written once per training call. Never read by inference.
 */
@Entity
@Table(name = "training_examples")
public class TrainingExample {

    public static final int TEXT_LENGTH = 2000;

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "transaction_id", length = WordFrequency.KEY_LENGTH)
    private String transactionId;

    @Column(name = "raw_text", length = TEXT_LENGTH)
    private String text;

    @Column(nullable = false, length = WordFrequency.KEY_LENGTH)
    private String category;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public TrainingExample() {}

    public TrainingExample(String id, String transactionId, String text, String category, Instant createdAt) {
        this.id = id;
        this.transactionId = transactionId;
        this.text = text;
        this.category = category;
        this.createdAt = createdAt;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getTransactionId() { return transactionId; }
    public void setTransactionId(String transactionId) { this.transactionId = transactionId; }

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
