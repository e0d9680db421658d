package org.nowstart.fundrank.repository;

import org.nowstart.fundrank.config.MfApiFeignConfig;
import org.nowstart.fundrank.data.dto.MfApiNavHistoryResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

@FeignClient(
        name = "mfApiClient",
        url = "${fundrank.nav-source.base-url:https://api.mfapi.in}",
        configuration = MfApiFeignConfig.class
)
public interface MfApiFeignClient {

    @GetMapping("/mf/{schemeCode}")
    MfApiNavHistoryResponse getNavHistory(@PathVariable("schemeCode") String schemeCode);
}
