package com.fleet.admin.mapper;

import com.fleet.admin.entity.NodePinnedSni;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;

public interface NodePinnedSniMapper extends BaseMapper<NodePinnedSni> {

}
