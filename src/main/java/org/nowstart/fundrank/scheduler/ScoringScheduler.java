package org.nowstart.fundrank.scheduler;

import java.time.LocalDate;
import lombok.RequiredArgsConstructor;
import org.nowstart.fundrank.service.batch.BatchScoringService;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ScoringScheduler {

    private final BatchScoringService batchScoringService;

    @Scheduled(cron = "${fundrank.scoring.cron:-}")
    public void run() {
        batchScoringService.scoreAll(LocalDate.now());
    }
}
