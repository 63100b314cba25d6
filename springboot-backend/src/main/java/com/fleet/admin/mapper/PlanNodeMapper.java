package com.fleet.admin.mapper;

import com.fleet.admin.entity.PlanNode;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;

public interface PlanNodeMapper extends BaseMapper<PlanNode> {

}
