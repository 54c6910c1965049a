package com.ai.flashcards.repository;

import com.ai.flashcards.model.QuotaRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Spring Data JPA repository for per-user usage counters.
 */
@Repository
public interface QuotaRecordRepository extends JpaRepository<QuotaRecord, String> {

    /**
     * Adds one upload and {@code pages} pages to the user's counters in a single
     * statement, but only while the user is still under the upload limit of their
     * tier and within their monthly page budget. When the stored month differs
     * from {@code currentMonth} the counters restart from this upload instead, so
     * a pending monthly reset and the increment land in the same write.
     *
     * @return number of rows updated; 0 when the user has no record yet or the
     *         upload would exceed the allowance
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
            update QuotaRecord q
               set q.uploadsThisMonth = case when q.resetMonth = :currentMonth
                                             then q.uploadsThisMonth + 1 else 1 end,
                   q.pagesThisMonth = case when q.resetMonth = :currentMonth
                                           then q.pagesThisMonth + :pages else :pages end,
                   q.resetMonth = :currentMonth,
                   q.lastUpdatedAt = :now
             where q.userId = :userId
               and (q.resetMonth <> :currentMonth
                    or (q.uploadsThisMonth < case when q.premium = true
                                                  then :premiumLimit else :freeLimit end
                        and (q.maxMonthlyPages is null
                             or q.pagesThisMonth + :pages <= q.maxMonthlyPages)))
            """)
    int incrementUsage(@Param("userId") String userId,
            @Param("pages") int pages,
            @Param("currentMonth") String currentMonth,
            @Param("freeLimit") int freeLimit,
            @Param("premiumLimit") int premiumLimit,
            @Param("now") LocalDateTime now);

    /**
     * Gives back one upload and {@code pages} pages recorded in
     * {@code currentMonth}. Counters from an earlier month are left alone.
     *
     * @return number of rows updated
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
            update QuotaRecord q
               set q.uploadsThisMonth = q.uploadsThisMonth - 1,
                   q.pagesThisMonth = case when q.pagesThisMonth >= :pages
                                           then q.pagesThisMonth - :pages else 0 end,
                   q.lastUpdatedAt = :now
             where q.userId = :userId
               and q.resetMonth = :currentMonth
               and q.uploadsThisMonth > 0
            """)
    int refundUsage(@Param("userId") String userId,
            @Param("pages") int pages,
            @Param("currentMonth") String currentMonth,
            @Param("now") LocalDateTime now);
}
