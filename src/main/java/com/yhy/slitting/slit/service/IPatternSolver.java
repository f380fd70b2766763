package com.yhy.slitting.slit.service;

import com.yhy.slitting.slit.vo.Coil;
import com.yhy.slitting.slit.vo.Order;
import com.yhy.slitting.slit.vo.Pattern;

import java.util.List;

/**
 * Selects the orders to cut from one coil. Implementations must be stateless.
 */
public interface IPatternSolver {

    /** Strategy name used to pick this solver in a request. */
    String getName();

    /**
     * @throws com.yhy.slitting.slit.exception.InvalidInputException           malformed coil or order
     * @throws com.yhy.slitting.slit.exception.OptimizationInfeasibleException no result could be certified
     */
    Pattern solve(Coil coil, List<Order> orders);
}
