package com.yhy.slitting;

import com.yhy.slitting.slit.service.PatternSolvers;
import com.yhy.slitting.slit.service.PlanAssembler;
import com.yhy.slitting.slit.vo.Coil;
import com.yhy.slitting.slit.vo.Order;
import com.yhy.slitting.slit.vo.Plan;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class SlittingApplicationTests {

	@Autowired
	private PlanAssembler planAssembler;

	@Autowired
	private PatternSolvers solvers;

	@Test
	void contextLoadsWithAllStrategies() {
		assertThat(solvers.names()).containsExactly("dp", "mip", "relaxed");

		Plan plan = planAssembler.assemble(List.of(Coil.of(100, 1000)),
				List.of(Order.of(30, 5), Order.of(40, 3), Order.of(50, 6), Order.of(20, 2)));

		assertThat(plan.getSlots().get(0).getAdjustedPattern().getCuts()).containsExactly(20.0, 30.0, 50.0);
	}

}
