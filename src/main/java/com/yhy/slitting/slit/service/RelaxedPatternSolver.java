package com.yhy.slitting.slit.service;

import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPVariable;
import com.yhy.slitting.config.SlittingProperties;
import com.yhy.slitting.slit.exception.OptimizationInfeasibleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Legacy behavior: LP relaxation with {@code 0 <= x <= 1}, orders with {@code x > 0.5} are cut.
 * <p>
 * The rounded selection can exceed the coil width; callers must check
 * {@link com.yhy.slitting.slit.vo.Pattern#fitsCoil()}.
 */
@Service
public class RelaxedPatternSolver extends AbstractPatternSolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(RelaxedPatternSolver.class);

    public static final String NAME = "relaxed";

    public RelaxedPatternSolver(SlittingProperties properties) {
        super(properties);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected int[] select(Scaled s) {
        Loader.loadNativeLibraries();

        MPSolver lp = MPSolver.createSolver("GLOP");
        if (lp == null) throw new OptimizationInfeasibleException("GLOP not available");

        final int n = s.size();
        MPObjective obj = lp.objective();
        obj.setMaximization();
        MPConstraint capacity = lp.makeConstraint(Double.NEGATIVE_INFINITY, s.capacity, "capacity");

        MPVariable[] x = new MPVariable[n];
        for (int i = 0; i < n; i++) {
            x[i] = lp.makeNumVar(0.0, 1.0, "x_" + i);
            capacity.setCoefficient(x[i], s.w[i]);
            obj.setCoefficient(x[i], s.v[i]);
        }

        MPSolver.ResultStatus st = lp.solve();
        if (st != MPSolver.ResultStatus.OPTIMAL) {
            throw new OptimizationInfeasibleException("GLOP failed: " + st);
        }

        List<Integer> chosen = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            double xi = x[i].solutionValue();
            if (xi > 0.5) chosen.add(i);
            if (xi > 1e-9 && xi < 1 - 1e-9) {
                LOGGER.debug("fractional x_{} = {}", i, xi);
            }
        }
        return chosen.stream().mapToInt(Integer::intValue).toArray();
    }
}
