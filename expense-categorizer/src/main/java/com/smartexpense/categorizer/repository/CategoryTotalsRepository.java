package com.smartexpense.categorizer.repository;

import com.smartexpense.categorizer.model.CategoryTotals;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public interface CategoryTotalsRepository extends JpaRepository<CategoryTotals, String> {

    List<CategoryTotals> findAllByOrderByCategoryAsc();

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = """
            MERGE INTO category_totals ct
            USING (SELECT CAST(:category AS VARCHAR(255)) AS category,
                          CAST(:tokenMass AS BIGINT) AS token_mass) src
            ON ct.category = src.category
            WHEN MATCHED THEN UPDATE SET total_words = ct.total_words + src.token_mass,
                                         doc_count = ct.doc_count + 1
            WHEN NOT MATCHED THEN INSERT (category, total_words, doc_count) VALUES (src.category, src.token_mass, 1)
            """, nativeQuery = true)
    int upsertIncrement(@Param("category") String category, @Param("tokenMass") long tokenMass);
}
