package com.work.validator.host.persistence.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.validator.host.persistence.entity.PendingMessageEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface PendingMessageMapper extends BaseMapper<PendingMessageEntity> {

    @Select("SELECT * FROM pending_message ORDER BY created_at, message_key LIMIT #{limit}")
    List<PendingMessageEntity> listOldest(@Param("limit") int limit);
}
