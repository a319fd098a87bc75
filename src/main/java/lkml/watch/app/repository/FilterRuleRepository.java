package lkml.watch.app.repository;

import lkml.watch.app.entity.FilterRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface FilterRuleRepository extends JpaRepository<FilterRule, String> {
    Optional<FilterRule> findByName(String name);

    List<FilterRule> findByEnabledTrueOrderByCreatedAtDesc();

    List<FilterRule> findAllByOrderByCreatedAtDesc();
}
