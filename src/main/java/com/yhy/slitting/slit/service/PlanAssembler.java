package com.yhy.slitting.slit.service;

import cn.hutool.core.util.IdUtil;
import com.yhy.slitting.config.SlittingProperties;
import com.yhy.slitting.slit.exception.InvalidInputException;
import com.yhy.slitting.slit.exception.OptimizationInfeasibleException;
import com.yhy.slitting.slit.vo.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.*;

/**
 * Solves every coil independently against the full order catalog and sequences the result.
 * A coil that fails keeps its slot with a failure marker; the other coils are unaffected.
 */
@Service
public class PlanAssembler {

    private static final Logger LOGGER = LoggerFactory.getLogger(PlanAssembler.class);

    private final PatternSolvers solvers;
    private final ShearSequencer sequencer;
    private final ExecutorService executor;
    private final SlittingProperties properties;

    public PlanAssembler(PatternSolvers solvers,
                         ShearSequencer sequencer,
                         @Qualifier("planExecutor") ExecutorService executor,
                         SlittingProperties properties) {
        this.solvers = solvers;
        this.sequencer = sequencer;
        this.executor = executor;
        this.properties = properties;
    }

    public Plan assemble(List<Coil> coils, List<Order> orders) {
        return assemble(coils, orders, null);
    }

    public Plan assemble(List<Coil> coils, List<Order> orders, String strategy) {
        if (coils == null) throw new InvalidInputException("coils must not be null");
        if (orders == null) throw new InvalidInputException("orders must not be null");
        IPatternSolver solver = solvers.resolve(strategy);

        final long start = System.nanoTime();
        final String planId = IdUtil.simpleUUID();

        // ===== 1) 订单校验：非法订单剔除，不影响其余计算 =====
        List<InvalidRecord> rejected = new ArrayList<>();
        List<Order> catalog = new ArrayList<>(orders.size());
        List<Integer> positions = new ArrayList<>(orders.size());
        for (int i = 0; i < orders.size(); i++) {
            Optional<InvalidRecord> bad = InputValidator.checkOrder(i, orders.get(i));
            if (bad.isPresent()) {
                rejected.add(bad.get());
            } else {
                catalog.add(orders.get(i));
                positions.add(i);
            }
        }
        if (!rejected.isEmpty()) {
            LOGGER.warn("Plan {}: rejected {} orders: {}", planId, rejected.size(), rejected);
        }
        List<Order> validOrders = List.copyOf(catalog);

        // ===== 2) 每卷独立求解 =====
        List<Future<PlanSlot>> futures = new ArrayList<>(coils.size());
        for (int i = 0; i < coils.size(); i++) {
            final int idx = i;
            final Coil coil = coils.get(i);
            Optional<InvalidRecord> badCoil = InputValidator.checkCoil(i, coil);
            if (badCoil.isPresent()) {
                LOGGER.warn("Plan {}: coil[{}] invalid: {}", planId, i, badCoil.get().getReason());
                futures.add(CompletableFuture.completedFuture(
                        PlanSlot.failed(i, coil, FailureType.INVALID_INPUT, badCoil.get().getReason())));
                continue;
            }
            futures.add(executor.submit(() -> solveSlot(idx, coil, validOrders, positions, solver)));
        }

        // ===== 3) 按输入顺序收集 =====
        long deadlineMs = properties.getPlan().getDeadlineMs();
        long deadline = deadlineMs > 0 ? start + TimeUnit.MILLISECONDS.toNanos(deadlineMs) : Long.MAX_VALUE;
        List<PlanSlot> slots = new ArrayList<>(coils.size());
        for (int i = 0; i < futures.size(); i++) {
            slots.add(collect(i, coils.get(i), futures.get(i), deadline, deadlineMs));
        }

        Plan plan = Plan.builder()
                .id(planId)
                .strategy(solver.getName())
                .slots(List.copyOf(slots))
                .rejectedOrders(List.copyOf(rejected))
                .build();

        LOGGER.info("Plan {} [{}]: {} coils x {} orders, {} failed, {} ms",
                planId, solver.getName(), coils.size(), validOrders.size(), plan.getFailedCount(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        return plan;
    }

    private PlanSlot solveSlot(int index, Coil coil, List<Order> catalog, List<Integer> positions, IPatternSolver solver) {
        try {
            Pattern solved = solver.solve(coil, catalog);
            Pattern pattern = toRequestIndices(solved, positions);
            if (!pattern.fitsCoil()) {
                throw new OptimizationInfeasibleException("cuts " + pattern.getCuts() + " use " + pattern.getUsedWidth()
                        + " of coil width " + coil.getWidth());
            }
            AdjustedPattern adjusted = sequencer.sequence(pattern);
            LOGGER.debug("coil[{}] {} -> {}", index, pattern.getCuts(), adjusted.getCuts());
            return PlanSlot.sequenced(index, coil, pattern, adjusted);
        } catch (InvalidInputException e) {
            LOGGER.warn("coil[{}] rejected by solver: {}", index, e.getMessage());
            return PlanSlot.failed(index, coil, FailureType.INVALID_INPUT, e.getMessage());
        } catch (OptimizationInfeasibleException e) {
            LOGGER.warn("coil[{}] infeasible with '{}': {}", index, solver.getName(), e.getMessage());
            return PlanSlot.failed(index, coil, FailureType.INFEASIBLE, e.getMessage());
        } catch (RuntimeException e) {
            LOGGER.error("coil[{}] solver '{}' failed", index, solver.getName(), e);
            return PlanSlot.failed(index, coil, FailureType.INFEASIBLE, String.valueOf(e.getMessage()));
        }
    }

    private PlanSlot collect(int index, Coil coil, Future<PlanSlot> future, long deadline, long deadlineMs) {
        try {
            if (deadline == Long.MAX_VALUE) {
                return future.get();
            }
            long remaining = Math.max(0L, deadline - System.nanoTime());
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOGGER.warn("coil[{}] not solved within {} ms", index, deadlineMs);
            return PlanSlot.failed(index, coil, FailureType.DEADLINE_EXCEEDED,
                    "not solved within " + deadlineMs + " ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return PlanSlot.failed(index, coil, FailureType.DEADLINE_EXCEEDED, "interrupted");
        } catch (ExecutionException e) {
            LOGGER.error("coil[{}] task failed", index, e.getCause());
            return PlanSlot.failed(index, coil, FailureType.INFEASIBLE, String.valueOf(e.getCause()));
        }
    }

    // 求解时使用的是剔除非法订单后的列表，这里换回请求中的下标
    private static Pattern toRequestIndices(Pattern pattern, List<Integer> positions) {
        List<Integer> mapped = new ArrayList<>(pattern.getOrderIndices().size());
        for (int k : pattern.getOrderIndices()) {
            mapped.add(positions.get(k));
        }
        return pattern.toBuilder().orderIndices(List.copyOf(mapped)).build();
    }
}
