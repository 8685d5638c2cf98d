package com.foodtrace.domain.qc.adapter.repository;

import com.foodtrace.domain.qc.model.entity.QcGateEntity;

import java.util.Collection;
import java.util.List;

public interface IQcGateRepository {

    QcGateEntity save(QcGateEntity entity);

    QcGateEntity findById(Long id);

    QcGateEntity findByGateNumber(Integer gateNumber);

    List<QcGateEntity> findByIds(Collection<Long> ids);

    List<QcGateEntity> findAll();
}
