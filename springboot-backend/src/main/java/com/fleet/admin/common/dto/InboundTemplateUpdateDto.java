package com.fleet.admin.common.dto;

import lombok.Data;

import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

@Data
public class InboundTemplateUpdateDto {

    @NotNull(message = "模板ID不能为空")
    private Long id;

    @NotBlank(message = "模板名称不能为空")
    private String name;

    private String settingsTemplate;

    private String streamSettingsTemplate;

    @NotNull(message = "起始端口不能为空")
    @Min(value = 1, message = "端口必须在1-65535之间")
    @Max(value = 65535, message = "端口必须在1-65535之间")
    private Integer portRangeStart;

    @NotNull(message = "结束端口不能为空")
    @Min(value = 1, message = "端口必须在1-65535之间")
    @Max(value = 65535, message = "端口必须在1-65535之间")
    private Integer portRangeEnd;

    @Min(value = 0, message = "轮换间隔不能为负数")
    private Integer renewIntervalMins;

    private Boolean isActive;

}
