package com.yhy.slitting.slit.service;

import com.yhy.slitting.config.SlittingProperties;
import com.yhy.slitting.slit.exception.OptimizationInfeasibleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Exact 0/1 knapsack over capacity.
 * <p>
 * Among optimal selections the result has the fewest orders, then the lexicographically
 * smallest ascending list of order indices. Candidates are folded in from the last one
 * backwards over a single value row; one bit per candidate and capacity records whether taking
 * it keeps the optimum, so the forward reconstruction takes every such candidate.
 */
@Service
public class DynamicProgrammingPatternSolver extends AbstractPatternSolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(DynamicProgrammingPatternSolver.class);

    public static final String NAME = "dp";

    public DynamicProgrammingPatternSolver(SlittingProperties properties) {
        super(properties);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected int[] select(Scaled s) {
        final int n = s.size();
        final int cap = s.capacity;
        // 两行 (long + int) 加每个候选一张 cap+1 位的取舍位图
        long bytes = (cap + 1L) * (Long.BYTES + Integer.BYTES) + n * (cap + 1L) / Byte.SIZE;
        if (bytes > config.getMaxTableBytes()) {
            throw new OptimizationInfeasibleException("dp table of " + bytes + " bytes exceeds limit "
                    + config.getMaxTableBytes() + ", use strategy 'mip'");
        }

        // val[c]: 只用候选 i..n-1、容量 c 时的最大长度；cnt[c]: 该最优值下最少件数
        long[] val = new long[cap + 1];
        int[] cnt = new int[cap + 1];
        // take[i].get(c): 容量 c 时取候选 i 仍能达到 (最大长度, 最少件数)
        BitSet[] take = new BitSet[n];

        for (int i = n - 1; i >= 0; i--) {
            if (Thread.currentThread().isInterrupted()) {
                throw new OptimizationInfeasibleException("dp solve interrupted");
            }
            final int wi = s.w[i];
            final long vi = s.v[i];
            BitSet row = new BitSet(cap + 1);
            for (int c = cap; c >= wi; c--) {
                long tv = val[c - wi] + vi;
                int tk = cnt[c - wi] + 1;
                if (tv > val[c] || (tv == val[c] && tk <= cnt[c])) {
                    val[c] = tv;
                    cnt[c] = tk;
                    row.set(c);
                }
            }
            take[i] = row;
        }

        List<Integer> chosen = new ArrayList<>();
        int c = cap;
        for (int i = 0; i < n; i++) {
            if (take[i].get(c)) {
                chosen.add(i);
                c -= s.w[i];
            }
        }

        LOGGER.debug("dp: {} candidates, capacity {}, value {}, picked {}", n, cap, val[cap], chosen);
        return chosen.stream().mapToInt(Integer::intValue).toArray();
    }
}
