package com.yhy.slitting.slit.service;

import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPSolverParameters;
import com.google.ortools.linearsolver.MPVariable;
import com.yhy.slitting.config.SlittingProperties;
import com.yhy.slitting.slit.exception.OptimizationInfeasibleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Exact selection with SCIP branch-and-bound, for catalogs whose dp table would be too large.
 * Stage 1 maximizes total length; stage 2 keeps that length and minimizes the number of orders.
 */
@Service
public class BranchAndBoundPatternSolver extends AbstractPatternSolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(BranchAndBoundPatternSolver.class);

    public static final String NAME = "mip";

    public BranchAndBoundPatternSolver(SlittingProperties properties) {
        super(properties);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected int[] select(Scaled s) {
        Loader.loadNativeLibraries();

        MPSolver ip = MPSolver.createSolver("SCIP");
        if (ip == null) throw new OptimizationInfeasibleException("SCIP not available");
        ip.setTimeLimit(config.getTimeLimitMs());

        final int n = s.size();
        MPConstraint capacity = ip.makeConstraint(0.0, s.capacity, "capacity");
        MPVariable[] x = new MPVariable[n];
        for (int i = 0; i < n; i++) {
            x[i] = ip.makeBoolVar("x_" + i);
            capacity.setCoefficient(x[i], s.w[i]);
        }

        MPSolverParameters params = new MPSolverParameters();
        params.setDoubleParam(MPSolverParameters.DoubleParam.RELATIVE_MIP_GAP, 0.0);

        // ===== 1) 最大化总长度 =====
        MPObjective obj = ip.objective();
        obj.setMaximization();
        for (int i = 0; i < n; i++) {
            obj.setCoefficient(x[i], s.v[i]);
        }
        MPSolver.ResultStatus st = ip.solve(params);
        LOGGER.info("SCIP stage1 status: {}, candidates: {}, capacity: {}", st, n, s.capacity);
        checkStatus(st, "stage1");
        List<Integer> chosen = selected(x);
        long bestLength = 0L;
        for (int i : chosen) {
            bestLength += s.v[i];
        }

        // ===== 2) 总长度固定，最少件数 =====
        MPConstraint keep = ip.makeConstraint(bestLength - 0.5, MPSolver.infinity(), "keep_length");
        for (int i = 0; i < n; i++) {
            keep.setCoefficient(x[i], s.v[i]);
        }
        obj.clear();
        obj.setMinimization();
        for (int i = 0; i < n; i++) {
            obj.setCoefficient(x[i], 1.0);
        }
        try {
            st = ip.solve(params);
            LOGGER.info("SCIP stage2 status: {}, length kept: {}", st, bestLength);
            checkStatus(st, "stage2");
            chosen = selected(x);
        } catch (OptimizationInfeasibleException e) {
            LOGGER.warn("SCIP stage2 failed, keeping stage1 selection of {} orders", chosen.size(), e);
        }
        return chosen.stream().mapToInt(Integer::intValue).toArray();
    }

    private void checkStatus(MPSolver.ResultStatus st, String stage) {
        if (st != MPSolver.ResultStatus.OPTIMAL && st != MPSolver.ResultStatus.FEASIBLE) {
            throw new OptimizationInfeasibleException("SCIP " + stage + " failed: " + st);
        }
        if (st == MPSolver.ResultStatus.FEASIBLE) {
            LOGGER.warn("SCIP {} hit the time limit of {} ms, pattern may not be optimal", stage, config.getTimeLimitMs());
        }
    }

    private static List<Integer> selected(MPVariable[] x) {
        List<Integer> chosen = new ArrayList<>();
        for (int i = 0; i < x.length; i++) {
            if (x[i].solutionValue() > 0.5) chosen.add(i);
        }
        return chosen;
    }
}
