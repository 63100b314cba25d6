package com.fleet.admin.entity;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * <p>
 * 入站模板，作用于节点分组
 * 模板内容中可包含 {{port}}、{{sni}} 等占位符，实例化时替换
 * </p>
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class InboundTemplate extends BaseEntity {

    private static final long serialVersionUID = 1L;

    private String name;

    private String protocol;

    private String settingsTemplate;

    private String streamSettingsTemplate;

    private Long targetGroupId;

    private Integer portRangeStart;

    private Integer portRangeEnd;

    /** 轮换间隔（分钟），0 表示不轮换 */
    private Integer renewIntervalMins;

    private Boolean isActive;

}
