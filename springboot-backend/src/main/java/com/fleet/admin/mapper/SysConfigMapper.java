package com.fleet.admin.mapper;

import com.fleet.admin.entity.SysConfig;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;

public interface SysConfigMapper extends BaseMapper<SysConfig> {

}
