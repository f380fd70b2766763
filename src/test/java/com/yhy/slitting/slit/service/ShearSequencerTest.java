package com.yhy.slitting.slit.service;

import com.yhy.slitting.slit.vo.AdjustedPattern;
import com.yhy.slitting.slit.vo.Coil;
import com.yhy.slitting.slit.vo.Order;
import com.yhy.slitting.slit.vo.Pattern;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ShearSequencerTest {

    private final ShearSequencer sequencer = new ShearSequencer();

    private static Pattern patternOf(double... widths) {
        List<Order> orders = new ArrayList<>();
        List<Integer> selected = new ArrayList<>();
        for (int i = 0; i < widths.length; i++) {
            orders.add(Order.of(widths[i], 1));
            selected.add(i);
        }
        return Pattern.of(Coil.of(1000, 100), orders, selected);
    }

    @Test
    void sortsCutsAscending() {
        AdjustedPattern adjusted = sequencer.sequence(patternOf(30, 50, 20));

        assertThat(adjusted.getCuts()).containsExactly(20.0, 30.0, 50.0);
        assertThat(adjusted.getCoil()).isEqualTo(Coil.of(1000, 100));
    }

    @Test
    void keepsEveryWidthIncludingDuplicates() {
        Pattern pattern = patternOf(45.5, 12, 45.5, 7.25, 12);

        AdjustedPattern adjusted = sequencer.sequence(pattern);

        assertThat(adjusted.getCuts()).containsExactlyInAnyOrderElementsOf(pattern.getCuts());
        assertThat(adjusted.getCuts()).isSorted();
    }

    @Test
    void sequencingTwiceChangesNothing() {
        AdjustedPattern once = sequencer.sequence(patternOf(90, 10, 40, 40, 5));

        AdjustedPattern twice = sequencer.sequence(once.asPattern());

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void emptyPatternStaysEmpty() {
        AdjustedPattern adjusted = sequencer.sequence(Pattern.empty(Coil.of(100, 10)));

        assertThat(adjusted.getCuts()).isEmpty();
        assertThat(adjusted.getBladeTravel()).isZero();
    }

    @Test
    void ascendingOrderReducesBladeTravel() {
        Pattern pattern = patternOf(30, 50, 20);

        AdjustedPattern adjusted = sequencer.sequence(pattern);

        assertThat(pattern.getBladeTravel()).isEqualTo(50.0);
        assertThat(adjusted.getBladeTravel()).isEqualTo(30.0);
    }
}
