package org.nowstart.fundrank.service.source;

import java.util.List;
import java.util.Optional;
import org.nowstart.fundrank.data.dto.FundAttributes;
import org.nowstart.fundrank.data.dto.PeerGroupKey;

public interface FundAttributesReader {

    Optional<FundAttributes> readFundAttributes(String fundId);

    List<FundAttributes> readActiveFunds();

    List<FundAttributes> readPeerGroupMembers(PeerGroupKey peerGroup);
}
