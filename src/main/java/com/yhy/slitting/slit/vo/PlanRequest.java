package com.yhy.slitting.slit.vo;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import jakarta.validation.constraints.NotNull;
import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class PlanRequest {

    @NotNull(message = "coils不能为空")
    private List<Coil> coils;

    @NotNull(message = "orders不能为空")
    private List<Order> orders;

    private String strategy;

    /** 为 true 时任一母卷失败即整体报错 */
    private boolean requireComplete;
}
