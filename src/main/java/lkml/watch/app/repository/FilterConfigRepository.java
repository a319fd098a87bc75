package lkml.watch.app.repository;

import lkml.watch.app.entity.FilterConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface FilterConfigRepository extends JpaRepository<FilterConfig, String> {
}
