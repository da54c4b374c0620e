package com.barthel.spi.adapter.out.db.repository;

import com.barthel.spi.adapter.out.db.entity.SpiResultEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SpiResultRepository extends JpaRepository<SpiResultEntity, Long> {
}
