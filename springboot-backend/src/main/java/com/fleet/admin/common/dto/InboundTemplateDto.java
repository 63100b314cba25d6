package com.fleet.admin.common.dto;

import lombok.Data;

import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

@Data
public class InboundTemplateDto {

    @NotBlank(message = "模板名称不能为空")
    private String name;

    @NotBlank(message = "协议不能为空")
    private String protocol;

    private String settingsTemplate;

    private String streamSettingsTemplate;

    @NotNull(message = "目标分组不能为空")
    private Long targetGroupId;

    @NotNull(message = "起始端口不能为空")
    @Min(value = 1, message = "端口必须在1-65535之间")
    @Max(value = 65535, message = "端口必须在1-65535之间")
    private Integer portRangeStart;

    @NotNull(message = "结束端口不能为空")
    @Min(value = 1, message = "端口必须在1-65535之间")
    @Max(value = 65535, message = "端口必须在1-65535之间")
    private Integer portRangeEnd;

    // 轮换间隔（分钟），0 为不轮换
    @Min(value = 0, message = "轮换间隔不能为负数")
    private Integer renewIntervalMins = 0;

    private Boolean isActive = true;

}
