package com.fleet.admin.mapper;

import com.fleet.admin.entity.PlanInbound;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface PlanInboundMapper extends BaseMapper<PlanInbound> {

    /**
     * 入站关联的套餐：直接关联入站、关联节点、关联节点所在分组
     */
    @Select("SELECT plan_id FROM plan_inbound WHERE inbound_id = #{inboundId} " +
            "UNION " +
            "SELECT plan_id FROM plan_node WHERE node_id = #{nodeId} " +
            "UNION " +
            "SELECT pg.plan_id FROM plan_group pg " +
            "JOIN node_group_member ngm ON pg.group_id = ngm.group_id " +
            "WHERE ngm.node_id = #{nodeId}")
    List<Long> selectLinkedPlanIds(@Param("nodeId") Long nodeId, @Param("inboundId") Long inboundId);
}
