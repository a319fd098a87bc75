package lkml.watch.app.repository;

import lkml.watch.app.entity.PatchThread;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PatchThreadRepository extends JpaRepository<PatchThread, String> {
    Optional<PatchThread> findByPatchCardMessageIdHeader(String patchCardMessageIdHeader);

    Optional<PatchThread> findByThreadId(String threadId);

    long countByActiveTrue();
}
