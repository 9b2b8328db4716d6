package com.smartexpense.categorizer.repository;

import com.smartexpense.categorizer.model.TrainingExample;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TrainingExampleRepository extends JpaRepository<TrainingExample, String> {

    List<TrainingExample> findAllByOrderByCreatedAtAsc();
}
