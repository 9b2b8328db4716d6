package com.smartexpense.categorizer.repository;

import com.smartexpense.categorizer.model.ModelMeta;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public interface ModelMetaRepository extends JpaRepository<ModelMeta, String> {

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = """
            MERGE INTO model_meta mm
            USING (SELECT CAST(:key AS VARCHAR(64)) AS meta_key,
                          CAST(:value AS BIGINT) AS meta_value) src
            ON mm.meta_key = src.meta_key
            WHEN MATCHED THEN UPDATE SET meta_value = CAST(src.meta_value AS VARCHAR(64))
            WHEN NOT MATCHED THEN INSERT (meta_key, meta_value) VALUES (src.meta_key, CAST(src.meta_value AS VARCHAR(64)))
            """, nativeQuery = true)
    int upsertNumber(@Param("key") String key, @Param("value") long value);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = """
            MERGE INTO model_meta mm
            USING (SELECT CAST(:key AS VARCHAR(64)) AS meta_key,
                          CAST(:delta AS BIGINT) AS delta) src
            ON mm.meta_key = src.meta_key
            WHEN MATCHED THEN UPDATE SET meta_value = CAST(CAST(mm.meta_value AS BIGINT) + src.delta AS VARCHAR(64))
            WHEN NOT MATCHED THEN INSERT (meta_key, meta_value) VALUES (src.meta_key, CAST(src.delta AS VARCHAR(64)))
            """, nativeQuery = true)
    int upsertAdd(@Param("key") String key, @Param("delta") long delta);
}
