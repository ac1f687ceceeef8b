package com.infomedia.abacox.feeschedule.db.repository;

import com.infomedia.abacox.feeschedule.db.entity.ConfigValue;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ConfigValueRepository extends JpaRepository<ConfigValue, Long> {

    Optional<ConfigValue> findByKey(String key);
}
