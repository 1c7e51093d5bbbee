package com.example.securebudget.dto;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A decrypted item row as shown to the user.
 *
 * description and amountText already carry the decrypt-error marker when a field failed;
 * amount is null whenever the row does not count towards the total.
 */
@Value
public class ItemLine {
    public static final String DECRYPTION_ERROR = "[Decryption Error]";

    Long id;
    String description;
    String amountText;
    BigDecimal amount;
    boolean descriptionFailed;
    boolean amountFailed;
    boolean invalidAmount;

    public boolean countsTowardsTotal() {
        return amount != null;
    }

    public boolean hasError() {
        return descriptionFailed || amountFailed || invalidAmount;
    }
}
