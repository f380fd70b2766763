package com.yhy.slitting.slit.service;

import com.yhy.slitting.config.SlittingProperties;
import com.yhy.slitting.slit.exception.InvalidInputException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Registry of solver strategies, keyed by {@link IPatternSolver#getName()}.
 */
@Service
public class PatternSolvers {

    private final Map<String, IPatternSolver> byName = new TreeMap<>();
    private final String defaultStrategy;

    public PatternSolvers(List<IPatternSolver> solvers, SlittingProperties properties) {
        for (IPatternSolver solver : solvers) {
            byName.put(solver.getName(), solver);
        }
        this.defaultStrategy = properties.getSolver().getDefaultStrategy();
        if (!byName.containsKey(defaultStrategy)) {
            throw new IllegalStateException("default strategy '" + defaultStrategy + "' is not registered: " + byName.keySet());
        }
    }

    /**
     * Returns the solver for {@code name}, or the configured default when it is blank.
     */
    public IPatternSolver resolve(String name) {
        String key = (name == null || name.isBlank()) ? defaultStrategy : name.trim();
        IPatternSolver solver = byName.get(key);
        if (solver == null) {
            throw new InvalidInputException("unknown strategy '" + key + "', expected one of " + byName.keySet());
        }
        return solver;
    }

    public List<String> names() {
        return new ArrayList<>(byName.keySet());
    }
}
