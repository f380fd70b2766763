package com.yhy.slitting.slit.exception;

import com.yhy.slitting.slit.vo.InvalidRecord;

import java.util.Collections;
import java.util.List;

/**
 * Malformed coil/order data detected before solving.
 */
public class InvalidInputException extends SlittingException {

    private final List<InvalidRecord> records;

    public InvalidInputException(String message) {
        super(message);
        this.records = Collections.emptyList();
    }

    public InvalidInputException(InvalidRecord record) {
        super(record.getKind() + "[" + record.getIndex() + "]: " + record.getReason());
        this.records = List.of(record);
    }

    public List<InvalidRecord> getRecords() {
        return records;
    }
}
