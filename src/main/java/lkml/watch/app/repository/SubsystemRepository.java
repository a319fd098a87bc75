package lkml.watch.app.repository;

import lkml.watch.app.entity.Subsystem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SubsystemRepository extends JpaRepository<Subsystem, String> {
    List<Subsystem> findBySubscribedTrueOrderByNameAsc();
}
