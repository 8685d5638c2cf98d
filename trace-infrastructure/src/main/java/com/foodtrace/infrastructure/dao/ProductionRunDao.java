package com.foodtrace.infrastructure.dao;

import com.foodtrace.infrastructure.dao.po.ProductionRunPO;
import com.foodtrace.types.enums.RunStatusEnum;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * Production run DAO.
 */
@Mapper
public interface ProductionRunDao {

    /**
     * {@code INSERT ... ON CONFLICT (idempotency_key) DO NOTHING}.
     *
     * @return 1 when inserted, 0 when the key already exists
     */
    int insertIgnoreConflict(ProductionRunPO po);

    int updateWithVersion(ProductionRunPO po);

    ProductionRunPO selectById(@Param("id") Long id);

    ProductionRunPO selectByIdForUpdate(@Param("id") Long id);

    ProductionRunPO selectByIdempotencyKey(@Param("idempotencyKey") String idempotencyKey);

    List<ProductionRunPO> selectByStatus(@Param("status") RunStatusEnum status);

    void advisoryLockRunCode(@Param("prefix") String prefix);

    String selectMaxRunCodeByPrefix(@Param("prefix") String prefix);
}
