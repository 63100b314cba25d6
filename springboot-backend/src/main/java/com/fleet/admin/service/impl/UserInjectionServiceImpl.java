package com.fleet.admin.service.impl;

import com.alibaba.fastjson.JSON;
import com.fleet.admin.common.dto.ActiveSubscriptionDto;
import com.fleet.admin.common.dto.inbound.AmneziaWgSettings;
import com.fleet.admin.common.dto.inbound.Hysteria2Settings;
import com.fleet.admin.common.dto.inbound.InboundSettings;
import com.fleet.admin.common.dto.inbound.NaiveSettings;
import com.fleet.admin.common.dto.inbound.ShadowsocksSettings;
import com.fleet.admin.common.dto.inbound.StreamSettings;
import com.fleet.admin.common.dto.inbound.TrojanSettings;
import com.fleet.admin.common.dto.inbound.TuicSettings;
import com.fleet.admin.common.dto.inbound.VlessSettings;
import com.fleet.admin.common.utils.KeyUtil;
import com.fleet.admin.entity.Inbound;
import com.fleet.admin.entity.Node;
import com.fleet.admin.mapper.PlanInboundMapper;
import com.fleet.admin.mapper.SubscriptionMapper;
import com.fleet.admin.service.UserInjectionService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import javax.annotation.Resource;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 把订阅转换为各协议的用户凭据
 */
@Slf4j
@Service
public class UserInjectionServiceImpl implements UserInjectionService {

    public static final String VISION_FLOW = "xtls-rprx-vision";
    private static final String USER_PREFIX = "user_";
    private static final String AWG_SUBNET_PREFIX = "10.10.0.";
    private static final int AWG_ADDRESS_POOL = 250;
    private static final int AWG_ADDRESS_OFFSET = 2;

    @Resource
    private PlanInboundMapper planInboundMapper;

    @Resource
    private SubscriptionMapper subscriptionMapper;

    @Override
    public int injectUsers(Node node, Inbound inbound, InboundSettings settings) {
        List<ActiveSubscriptionDto> subscriptions = loadSubscriptions(node, inbound);

        switch (settings.protocol()) {
            case VLESS:
                ((VlessSettings) settings).setClients(toVlessClients(subscriptions, vlessFlow(inbound)));
                break;
            case HYSTERIA2:
                ((Hysteria2Settings) settings).setUsers(toHysteria2Users(subscriptions));
                break;
            case TROJAN:
                ((TrojanSettings) settings).setClients(toTrojanClients(subscriptions));
                break;
            case TUIC:
                ((TuicSettings) settings).setUsers(toTuicUsers(subscriptions));
                break;
            case NAIVE:
                ((NaiveSettings) settings).setUsers(toNaiveUsers(subscriptions));
                break;
            case SHADOWSOCKS:
                ((ShadowsocksSettings) settings).setUsers(toShadowsocksUsers(subscriptions));
                break;
            case AMNEZIAWG:
                ((AmneziaWgSettings) settings).setUsers(toAmneziaWgUsers(subscriptions));
                break;
            default:
                log.warn("入站 {} 的协议 {} 不支持注入用户", inbound.getTag(), settings.protocol());
                return 0;
        }
        return settings.userCount();
    }

    private List<ActiveSubscriptionDto> loadSubscriptions(Node node, Inbound inbound) {
        if (!Boolean.TRUE.equals(inbound.getEnable())) {
            return Collections.emptyList();
        }
        List<Long> planIds = planInboundMapper.selectLinkedPlanIds(node.getId(), inbound.getId());
        if (planIds == null || planIds.isEmpty()) {
            log.debug("入站 {} 没有关联任何套餐", inbound.getTag());
            return Collections.emptyList();
        }
        List<ActiveSubscriptionDto> subscriptions = subscriptionMapper.selectActiveByPlanIds(planIds);
        return subscriptions == null ? Collections.emptyList() : subscriptions;
    }

    /**
     * tcp 传输且 reality/tls 安全层时使用 vision 流控
     */
    private String vlessFlow(Inbound inbound) {
        String raw = inbound.getStreamSettings();
        if (StringUtils.isBlank(raw)) {
            return "";
        }
        StreamSettings stream = JSON.parseObject(raw, StreamSettings.class);
        if (stream == null) {
            return "";
        }
        boolean tcp = StringUtils.isBlank(stream.getNetwork()) || stream.networkIs("tcp");
        boolean secured = stream.securityIs("reality") || stream.securityIs("tls");
        return tcp && secured ? VISION_FLOW : "";
    }

    private List<VlessSettings.Client> toVlessClients(List<ActiveSubscriptionDto> subscriptions, String flow) {
        List<VlessSettings.Client> clients = new ArrayList<>();
        for (ActiveSubscriptionDto sub : subscriptions) {
            VlessSettings.Client client = new VlessSettings.Client();
            client.setId(sub.getSubscriptionUuid());
            client.setEmail(userName(sub));
            client.setFlow(flow);
            clients.add(client);
        }
        return clients;
    }

    private List<Hysteria2Settings.User> toHysteria2Users(List<ActiveSubscriptionDto> subscriptions) {
        List<Hysteria2Settings.User> users = new ArrayList<>();
        for (ActiveSubscriptionDto sub : subscriptions) {
            Hysteria2Settings.User user = new Hysteria2Settings.User();
            user.setName(userName(sub));
            user.setPassword(strippedSecret(sub));
            users.add(user);
        }
        return users;
    }

    private List<TrojanSettings.Client> toTrojanClients(List<ActiveSubscriptionDto> subscriptions) {
        List<TrojanSettings.Client> clients = new ArrayList<>();
        for (ActiveSubscriptionDto sub : subscriptions) {
            TrojanSettings.Client client = new TrojanSettings.Client();
            client.setEmail(userName(sub));
            client.setPassword(sub.getSubscriptionUuid());
            clients.add(client);
        }
        return clients;
    }

    private List<TuicSettings.User> toTuicUsers(List<ActiveSubscriptionDto> subscriptions) {
        List<TuicSettings.User> users = new ArrayList<>();
        for (ActiveSubscriptionDto sub : subscriptions) {
            TuicSettings.User user = new TuicSettings.User();
            user.setName(userName(sub));
            user.setUuid(sub.getSubscriptionUuid());
            user.setPassword(strippedSecret(sub));
            users.add(user);
        }
        return users;
    }

    private List<NaiveSettings.User> toNaiveUsers(List<ActiveSubscriptionDto> subscriptions) {
        List<NaiveSettings.User> users = new ArrayList<>();
        for (ActiveSubscriptionDto sub : subscriptions) {
            NaiveSettings.User user = new NaiveSettings.User();
            user.setUsername(userName(sub));
            user.setPassword(strippedSecret(sub));
            users.add(user);
        }
        return users;
    }

    private List<ShadowsocksSettings.User> toShadowsocksUsers(List<ActiveSubscriptionDto> subscriptions) {
        List<ShadowsocksSettings.User> users = new ArrayList<>();
        for (ActiveSubscriptionDto sub : subscriptions) {
            users.add(new ShadowsocksSettings.User(userName(sub), strippedSecret(sub)));
        }
        return users;
    }

    private List<AmneziaWgSettings.User> toAmneziaWgUsers(List<ActiveSubscriptionDto> subscriptions) {
        List<AmneziaWgSettings.User> users = new ArrayList<>();
        for (ActiveSubscriptionDto sub : subscriptions) {
            KeyUtil.X25519KeyPair keys = KeyUtil.deriveDeterministicKey(sub.getSubscriptionUuid());
            AmneziaWgSettings.User user = new AmneziaWgSettings.User();
            user.setName(userName(sub));
            user.setPrivateKey(keys.getPrivateKey());
            user.setPublicKey(keys.getPublicKey());
            user.setClientIp(amneziaWgClientIp(sub.getTgId()));
            users.add(user);
        }
        return users;
    }

    /**
     * 客户端地址 10.10.0.(tgId % 250 + 2)/32，保留 .0 与 .1
     */
    public static String amneziaWgClientIp(Long tgId) {
        long id = tgId == null ? 0L : Math.abs(tgId);
        return AWG_SUBNET_PREFIX + (id % AWG_ADDRESS_POOL + AWG_ADDRESS_OFFSET) + "/32";
    }

    private String userName(ActiveSubscriptionDto sub) {
        return USER_PREFIX + sub.getSubscriptionId();
    }

    private String strippedSecret(ActiveSubscriptionDto sub) {
        return StringUtils.remove(sub.getSubscriptionUuid(), '-');
    }
}
