package com.work.validator.host.persistence.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.validator.host.persistence.entity.RegisteredNodeEntity;

public interface RegisteredNodeMapper extends BaseMapper<RegisteredNodeEntity> {
}
