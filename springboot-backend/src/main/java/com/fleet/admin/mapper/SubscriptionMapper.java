package com.fleet.admin.mapper;

import com.fleet.admin.common.dto.ActiveSubscriptionDto;
import com.fleet.admin.entity.Subscription;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface SubscriptionMapper extends BaseMapper<Subscription> {

    @Select("<script>" +
            "SELECT s.id AS subscription_id, s.subscription_uuid, s.user_id, u.tg_id " +
            "FROM subscription s LEFT JOIN users u ON s.user_id = u.id " +
            "WHERE s.subscription_status = 'active' AND s.subscription_uuid IS NOT NULL " +
            "AND s.plan_id IN " +
            "<foreach collection='planIds' item='planId' open='(' separator=',' close=')'>#{planId}</foreach> " +
            "ORDER BY s.id" +
            "</script>")
    List<ActiveSubscriptionDto> selectActiveByPlanIds(@Param("planIds") List<Long> planIds);
}
