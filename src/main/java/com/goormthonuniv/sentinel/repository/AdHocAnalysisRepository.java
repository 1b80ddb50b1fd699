package com.goormthonuniv.sentinel.repository;

import com.goormthonuniv.sentinel.entity.AdHocAnalysis;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface AdHocAnalysisRepository extends JpaRepository<AdHocAnalysis, UUID> {
}
