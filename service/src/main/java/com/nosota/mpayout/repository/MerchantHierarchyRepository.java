package com.nosota.mpayout.repository;

import com.nosota.mpayout.model.MerchantHierarchy;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface MerchantHierarchyRepository extends JpaRepository<MerchantHierarchy, Long> {
}
