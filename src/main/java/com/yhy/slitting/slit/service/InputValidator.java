package com.yhy.slitting.slit.service;

import com.yhy.slitting.slit.vo.Coil;
import com.yhy.slitting.slit.vo.InvalidRecord;
import com.yhy.slitting.slit.vo.Order;

import java.util.Optional;

/**
 * Boundary checks for coil and order records.
 */
public final class InputValidator {

    private InputValidator() {
    }

    public static Optional<InvalidRecord> checkCoil(int index, Coil coil) {
        if (coil == null) {
            return Optional.of(new InvalidRecord(InvalidRecord.Kind.COIL, index, "missing coil"));
        }
        if (!Double.isFinite(coil.getWidth()) || coil.getWidth() < 0) {
            return Optional.of(new InvalidRecord(InvalidRecord.Kind.COIL, index,
                    "width must be a non-negative number, got " + coil.getWidth()));
        }
        if (!Double.isFinite(coil.getLength()) || coil.getLength() < 0) {
            return Optional.of(new InvalidRecord(InvalidRecord.Kind.COIL, index,
                    "length must be a non-negative number, got " + coil.getLength()));
        }
        return Optional.empty();
    }

    public static Optional<InvalidRecord> checkOrder(int index, Order order) {
        if (order == null) {
            return Optional.of(new InvalidRecord(InvalidRecord.Kind.ORDER, index, "missing order"));
        }
        if (!Double.isFinite(order.getWidth()) || order.getWidth() <= 0) {
            return Optional.of(new InvalidRecord(InvalidRecord.Kind.ORDER, index,
                    "width must be positive, got " + order.getWidth()));
        }
        if (!Double.isFinite(order.getLength()) || order.getLength() < 0) {
            return Optional.of(new InvalidRecord(InvalidRecord.Kind.ORDER, index,
                    "length must be a non-negative number, got " + order.getLength()));
        }
        return Optional.empty();
    }
}
