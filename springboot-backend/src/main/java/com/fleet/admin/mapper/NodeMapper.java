package com.fleet.admin.mapper;

import com.fleet.admin.entity.Node;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;

public interface NodeMapper extends BaseMapper<Node> {

}
