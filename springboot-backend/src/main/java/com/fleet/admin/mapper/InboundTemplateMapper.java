package com.fleet.admin.mapper;

import com.fleet.admin.entity.InboundTemplate;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;

public interface InboundTemplateMapper extends BaseMapper<InboundTemplate> {

}
