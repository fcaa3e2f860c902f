package com.wangbin.idlegateway.common.domain.entity;

import com.wangbin.idlegateway.common.enums.GatewayKind;
import lombok.Builder;
import lombok.Value;

/**
 * 网关实体
 * 由发现组件产出，分析过程只读
 */
@Value
@Builder
public class Gateway {

    /**
     * 网关ID（nat-xxx / igw-xxx）
     */
    String id;

    /**
     * 网关类型
     */
    GatewayKind kind;

    /**
     * 显示名称
     */
    String displayName;

    /**
     * 所属 VPC ID
     */
    String networkId;

    /**
     * 所属 VPC 名称
     */
    String networkName;
}
