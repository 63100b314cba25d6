package com.fleet.admin.mapper;

import com.fleet.admin.entity.PlanGroup;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;

public interface PlanGroupMapper extends BaseMapper<PlanGroup> {

}
