package com.newsintel.alcalor.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one bulk upsert. Partial success is normal: failed items land in
 * {@code errors} and do not roll back the rest of the batch.
 */
@Data
public class InsertResult {

    private int total;
    private int inserted;
    private int updated;
    private List<String> errors = new ArrayList<>();

    public static InsertResult forBatch(int total) {
        InsertResult result = new InsertResult();
        result.setTotal(total);
        return result;
    }

    public void record(UpsertOutcome outcome) {
        switch (outcome) {
            case INSERTED -> inserted++;
            case UPDATED -> updated++;
        }
    }

    public void recordError(String error) {
        errors.add(error);
    }
}
