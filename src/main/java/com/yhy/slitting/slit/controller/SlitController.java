package com.yhy.slitting.slit.controller;

import com.yhy.slitting.slit.service.PatternSolvers;
import com.yhy.slitting.slit.service.PlanAssembler;
import com.yhy.slitting.slit.vo.Plan;
import com.yhy.slitting.slit.vo.PlanRequest;
import com.yhy.slitting.slit.vo.R;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;


@RestController()
@RequestMapping(value = "api/slit")
public class SlitController {

    private final PlanAssembler planAssembler;
    private final PatternSolvers solvers;

    public SlitController(PlanAssembler planAssembler, PatternSolvers solvers) {
        this.planAssembler = planAssembler;
        this.solvers = solvers;
    }

    @PostMapping(value = "plan")
    public R<Plan> plan(@Valid @RequestBody PlanRequest request) {
        Plan plan = planAssembler.assemble(request.getCoils(), request.getOrders(), request.getStrategy());
        if (request.isRequireComplete()) {
            plan.requireComplete();
        }
        if (plan.isPartialFailure()) {
            return R.ok(plan, plan.getFailedCount() + " of " + plan.getSlots().size() + " coils failed");
        }
        return R.ok(plan);
    }

    @GetMapping(value = "strategies")
    public R<List<String>> strategies() {
        return R.ok(solvers.names());
    }

}
