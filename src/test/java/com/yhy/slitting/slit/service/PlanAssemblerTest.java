package com.yhy.slitting.slit.service;

import com.yhy.slitting.config.SlittingProperties;
import com.yhy.slitting.slit.exception.AssemblyPartialFailureException;
import com.yhy.slitting.slit.exception.InvalidInputException;
import com.yhy.slitting.slit.exception.OptimizationInfeasibleException;
import com.yhy.slitting.slit.vo.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.BiFunction;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlanAssemblerTest {

    private static final List<Order> ORDERS = List.of(
            Order.of(30, 5), Order.of(40, 3), Order.of(50, 6), Order.of(20, 2));

    private final SlittingProperties properties = new SlittingProperties();
    private final DynamicProgrammingPatternSolver dp = new DynamicProgrammingPatternSolver(properties);
    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    private PlanAssembler assembler(IPatternSolver... extra) {
        List<IPatternSolver> all = new ArrayList<>(List.of(extra));
        all.add(dp);
        return new PlanAssembler(new PatternSolvers(all, properties), new ShearSequencer(), executor, properties);
    }

    private static IPatternSolver solver(String name, BiFunction<Coil, List<Order>, Pattern> fn) {
        return new IPatternSolver() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public Pattern solve(Coil coil, List<Order> orders) {
                return fn.apply(coil, orders);
            }
        };
    }

    @Test
    void batchKeepsInputOrder() {
        Plan plan = assembler().assemble(List.of(Coil.of(0, 1000), Coil.of(100, 1000)), ORDERS);

        assertThat(plan.getStrategy()).isEqualTo("dp");
        assertThat(plan.getId()).isNotBlank();
        assertThat(plan.getSlots()).hasSize(2);
        assertThat(plan.isPartialFailure()).isFalse();

        PlanSlot first = plan.getSlots().get(0);
        assertThat(first.getIndex()).isZero();
        assertThat(first.getStatus()).isEqualTo(SlotStatus.SEQUENCED);
        assertThat(first.getPattern().isEmpty()).isTrue();
        assertThat(first.getAdjustedPattern().getCuts()).isEmpty();

        PlanSlot second = plan.getSlots().get(1);
        assertThat(second.getCoil()).isEqualTo(Coil.of(100, 1000));
        assertThat(second.getPattern().getCuts()).containsExactlyInAnyOrder(20.0, 30.0, 50.0);
        assertThat(second.getAdjustedPattern().getCuts()).containsExactly(20.0, 30.0, 50.0);
    }

    @Test
    void ordersAreOfferedToEveryCoil() {
        Plan plan = assembler().assemble(List.of(Coil.of(100, 1000), Coil.of(100, 2000)), ORDERS);

        assertThat(plan.getSlots()).allSatisfy(slot ->
                assertThat(slot.getPattern().getOrderIndices()).containsExactly(0, 2, 3));
    }

    @Test
    void everyPatternRespectsCapacityAndSequencingKeepsWidths() {
        List<Coil> coils = IntStream.rangeClosed(0, 12)
                .mapToObj(i -> Coil.of(i * 17.5, 1000))
                .collect(Collectors.toList());

        Plan plan = assembler().assemble(coils, ORDERS);

        assertThat(plan.getSlots()).hasSize(coils.size());
        for (PlanSlot slot : plan.getSlots()) {
            assertThat(slot.getCoil()).isEqualTo(coils.get(slot.getIndex()));
            assertThat(slot.getPattern().getUsedWidth()).isLessThanOrEqualTo(slot.getCoil().getWidth());
            assertThat(slot.getAdjustedPattern().getCuts())
                    .isSorted()
                    .containsExactlyInAnyOrderElementsOf(slot.getPattern().getCuts());
        }
    }

    @Test
    void invalidCoilFailsOnlyItsOwnSlot() {
        Plan plan = assembler().assemble(List.of(Coil.of(-5, 10), Coil.of(100, 10)), ORDERS);

        assertThat(plan.getSlots().get(0).getStatus()).isEqualTo(SlotStatus.FAILED);
        assertThat(plan.getSlots().get(0).getFailure().getType()).isEqualTo(FailureType.INVALID_INPUT);
        assertThat(plan.getSlots().get(1).getStatus()).isEqualTo(SlotStatus.SEQUENCED);
        assertThat(plan.isPartialFailure()).isTrue();
        assertThat(plan.getFailedCount()).isEqualTo(1);
        assertThatThrownBy(plan::requireComplete)
                .isInstanceOf(AssemblyPartialFailureException.class)
                .hasMessage("1 of 2 coils failed");
    }

    @Test
    void invalidOrdersAreRejectedAndIndicesStayOnRequestPositions() {
        List<Order> orders = new ArrayList<>();
        orders.add(Order.of(0, 5));
        orders.addAll(ORDERS);

        Plan plan = assembler().assemble(List.of(Coil.of(100, 10)), orders);

        assertThat(plan.getRejectedOrders()).hasSize(1);
        assertThat(plan.getRejectedOrders().get(0).getIndex()).isZero();
        assertThat(plan.getRejectedOrders().get(0).getKind()).isEqualTo(InvalidRecord.Kind.ORDER);
        assertThat(plan.getSlots().get(0).getPattern().getOrderIndices()).containsExactly(1, 3, 4);
        assertThat(plan.isPartialFailure()).isFalse();
    }

    @Test
    void solverFailureDoesNotStopOtherCoils() {
        IPatternSolver flaky = solver("flaky", (coil, orders) -> {
            if (coil.getWidth() == 77) {
                throw new OptimizationInfeasibleException("no certificate");
            }
            return dp.solve(coil, orders);
        });

        Plan plan = assembler(flaky).assemble(
                List.of(Coil.of(100, 1), Coil.of(77, 1), Coil.of(100, 1)), ORDERS, "flaky");

        assertThat(plan.getSlots()).extracting(PlanSlot::getStatus)
                .containsExactly(SlotStatus.SEQUENCED, SlotStatus.FAILED, SlotStatus.SEQUENCED);
        assertThat(plan.getSlots().get(1).getFailure().getType()).isEqualTo(FailureType.INFEASIBLE);
        assertThat(plan.getSlots().get(1).getFailure().getMessage()).isEqualTo("no certificate");
    }

    @Test
    void unexpectedSolverErrorIsRecordedAsInfeasible() {
        IPatternSolver broken = solver("broken", (coil, orders) -> {
            throw new IllegalStateException("boom");
        });

        Plan plan = assembler(broken).assemble(List.of(Coil.of(100, 1)), ORDERS, "broken");

        assertThat(plan.getSlots().get(0).getFailure().getType()).isEqualTo(FailureType.INFEASIBLE);
        assertThat(plan.getSlots().get(0).getFailure().getMessage()).isEqualTo("boom");
    }

    @Test
    void overfullPatternIsCaught() {
        IPatternSolver overfull = solver("overfull", (coil, orders) ->
                Pattern.of(coil, orders, List.of(0, 1, 2, 3)));

        Plan plan = assembler(overfull).assemble(List.of(Coil.of(100, 1)), ORDERS, "overfull");

        PlanSlot slot = plan.getSlots().get(0);
        assertThat(slot.getStatus()).isEqualTo(SlotStatus.FAILED);
        assertThat(slot.getFailure().getType()).isEqualTo(FailureType.INFEASIBLE);
        assertThat(slot.getFailure().getMessage()).contains("coil width 100.0");
        assertThat(slot.getPattern()).isNull();
    }

    @Test
    void slowCoilMissesDeadlineWithoutBlockingOthers() {
        properties.getPlan().setDeadlineMs(300);
        IPatternSolver slow = solver("slow", (coil, orders) -> {
            if (coil.getWidth() == 999) {
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new OptimizationInfeasibleException("interrupted", e);
                }
            }
            return dp.solve(coil, orders);
        });

        long start = System.currentTimeMillis();
        Plan plan = assembler(slow).assemble(List.of(Coil.of(100, 1), Coil.of(999, 1)), ORDERS, "slow");

        assertThat(System.currentTimeMillis() - start).isLessThan(5_000);
        assertThat(plan.getSlots().get(0).getStatus()).isEqualTo(SlotStatus.SEQUENCED);
        assertThat(plan.getSlots().get(1).getFailure().getType()).isEqualTo(FailureType.DEADLINE_EXCEEDED);
    }

    @Test
    void unknownStrategyRejectsTheRequest() {
        assertThatThrownBy(() -> assembler().assemble(List.of(Coil.of(100, 1)), ORDERS, "nope"))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void missingListsAreInvalidInput() {
        assertThatThrownBy(() -> assembler().assemble(null, ORDERS))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> assembler().assemble(List.of(Coil.of(100, 1)), null))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void emptyCoilListGivesEmptyPlan() {
        Plan plan = assembler().assemble(List.of(), ORDERS);

        assertThat(plan.getSlots()).isEmpty();
        assertThat(plan.requireComplete()).isSameAs(plan);
    }
}
