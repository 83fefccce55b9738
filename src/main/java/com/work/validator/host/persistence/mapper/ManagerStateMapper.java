package com.work.validator.host.persistence.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.validator.host.persistence.entity.ManagerStateEntity;
import org.apache.ibatis.annotations.Select;

public interface ManagerStateMapper extends BaseMapper<ManagerStateEntity> {

    /**
     * 锁住全局状态行，串行化所有账本写事务。
     */
    @Select("SELECT * FROM manager_state WHERE id = 1 FOR UPDATE")
    ManagerStateEntity lockManagerState();
}
