package com.smartexpense.categorizer.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public class TrainRequest {

    @NotBlank
    @Size(max = 255)
    private String transactionId;

    private String text;
    private String note;
    private String merchant;

    @NotBlank
    @Size(max = 255)
    private String category;

    // optional, coerced to an integer >= 1 by the trainer
    private Double weight;

    public TrainRequest() {}

    public String getTransactionId() { return transactionId; }
    public void setTransactionId(String transactionId) { this.transactionId = transactionId; }

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    public String getNote() { return note; }
    public void setNote(String note) { this.note = note; }

    public String getMerchant() { return merchant; }
    public void setMerchant(String merchant) { this.merchant = merchant; }

    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }

    public Double getWeight() { return weight; }
    public void setWeight(Double weight) { this.weight = weight; }
}
