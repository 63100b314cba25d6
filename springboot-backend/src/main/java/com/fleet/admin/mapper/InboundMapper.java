package com.fleet.admin.mapper;

import com.fleet.admin.entity.Inbound;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface InboundMapper extends BaseMapper<Inbound> {

    @Select("SELECT listen_port FROM inbound WHERE node_id = #{nodeId}")
    List<Integer> selectUsedPorts(@Param("nodeId") Long nodeId);
}
