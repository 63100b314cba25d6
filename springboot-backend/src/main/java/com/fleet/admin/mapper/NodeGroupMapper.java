package com.fleet.admin.mapper;

import com.fleet.admin.entity.NodeGroup;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;

public interface NodeGroupMapper extends BaseMapper<NodeGroup> {

}
