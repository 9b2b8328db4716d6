package com.smartexpense.categorizer.model;

import jakarta.persistence.*;

/**
 * Key/value settings of the learned model. Holds at least {@link #VOCAB_SIZE}.
 */
@Entity
@Table(name = "model_meta")
public class ModelMeta {

    public static final String VOCAB_SIZE = "vocab_size";

    @Id
    @Column(name = "meta_key", length = 64)
    private String key;

    @Column(name = "meta_value", length = 64)
    private String value;

    public ModelMeta() {}

    public ModelMeta(String key, String value) {
        this.key = key;
        this.value = value;
    }

    public String getKey() { return key; }
    public void setKey(String key) { this.key = key; }

    public String getValue() { return value; }
    public void setValue(String value) { this.value = value; }
}
