package com.yhy.slitting.slit.service;

import com.yhy.slitting.slit.vo.AdjustedPattern;
import com.yhy.slitting.slit.vo.Pattern;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Shear adjustment: cuts run narrowest first so the blade moves one way across the coil.
 * This only sorts; it does not search orderings by actual repositioning cost.
 */
@Service
public class ShearSequencer {

    public AdjustedPattern sequence(Pattern pattern) {
        List<Double> sorted = new ArrayList<>(pattern.getCuts());
        sorted.sort(Double::compare);
        return AdjustedPattern.builder()
                .coil(pattern.getCoil())
                .cuts(List.copyOf(sorted))
                .bladeTravel(Pattern.bladeTravel(sorted))
                .build();
    }
}
