package com.foodtrace.domain.qc.adapter.repository;

import com.foodtrace.domain.qc.model.entity.QcDecisionEntity;

import java.util.Collection;
import java.util.List;

public interface IQcDecisionRepository {

    QcDecisionEntity save(QcDecisionEntity entity);

    /**
     * Decisions of a lot, oldest first.
     */
    List<QcDecisionEntity> findByLotId(Long lotId);

    /**
     * Decisions of the given lots, oldest first.
     */
    List<QcDecisionEntity> findByLotIds(Collection<Long> lotIds);
}
