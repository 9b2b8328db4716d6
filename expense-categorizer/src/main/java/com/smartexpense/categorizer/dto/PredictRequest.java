package com.smartexpense.categorizer.dto;

/**
 * Either {@code text} or any of {@code note}/{@code merchant} may be supplied.
 */
public class PredictRequest {

    private String text;
    private String note;
    private String merchant;

    public PredictRequest() {}

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    public String getNote() { return note; }
    public void setNote(String note) { this.note = note; }

    public String getMerchant() { return merchant; }
    public void setMerchant(String merchant) { this.merchant = merchant; }
}
