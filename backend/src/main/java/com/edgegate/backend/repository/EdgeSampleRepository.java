package com.edgegate.backend.repository;

import com.edgegate.backend.model.Direction;
import com.edgegate.backend.model.EdgeSampleEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface EdgeSampleRepository extends JpaRepository<EdgeSampleEntity, Long> {

    List<EdgeSampleEntity> findAllByOrderByIdAsc();

    long countBySymbolAndDirectionAndTimeframe(String symbol, Direction direction, String timeframe);

    @Query("select e.id from EdgeSampleEntity e where e.symbol = :symbol and e.direction = :direction "
            + "and e.timeframe = :timeframe order by e.id desc")
    List<Long> findIdsNewestFirst(@Param("symbol") String symbol,
                                  @Param("direction") Direction direction,
                                  @Param("timeframe") String timeframe);

    @Modifying
    @Query("delete from EdgeSampleEntity e where e.symbol = :symbol and e.direction = :direction "
            + "and e.timeframe = :timeframe and e.id < :minId")
    int deleteOlderThan(@Param("symbol") String symbol,
                        @Param("direction") Direction direction,
                        @Param("timeframe") String timeframe,
                        @Param("minId") Long minId);

    long deleteBySymbolAndDirectionAndTimeframe(String symbol, Direction direction, String timeframe);
}
