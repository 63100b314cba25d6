package com.fleet.admin.entity;

import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class NodeGroup extends BaseEntity {

    private static final long serialVersionUID = 1L;

    private String name;

    private String description;

}
