package lab.escrow.domain.request;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;

public interface EscrowRequestRepository extends JpaRepository<EscrowRequest, String> {

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update EscrowRequest r set r.status = :next, r.updatedAt = :now "
            + "where r.id = :id and r.status in :expected")
    int compareAndSetStatus(@Param("id") String id,
                            @Param("expected") Collection<RequestStatus> expected,
                            @Param("next") RequestStatus next,
                            @Param("now") Instant now);
}
