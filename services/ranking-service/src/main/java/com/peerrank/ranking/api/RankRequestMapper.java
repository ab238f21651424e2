package com.peerrank.ranking.api;

import com.peerrank.ranking.api.dto.RankRequest;
import com.peerrank.ranking.model.Candidate;
import com.peerrank.ranking.model.Target;
import java.util.ArrayList;
import java.util.List;

final class RankRequestMapper {

    private RankRequestMapper() {
    }

    static Target toTarget(RankRequest.TargetTrack target) {
        if (target == null) {
            return Target.empty();
        }
        return new Target(target.getTitle(), target.getArtist(), target.getLengthSeconds(), target.getBpm());
    }

    static List<Candidate> toCandidates(List<RankRequest.Candidate> source) {
        List<Candidate> candidates = new ArrayList<>(source.size());
        for (RankRequest.Candidate item : source) {
            candidates.add(item == null ? null : toCandidate(item));
        }
        return candidates;
    }

    private static Candidate toCandidate(RankRequest.Candidate item) {
        Candidate candidate = new Candidate();
        candidate.setSourceId(item.getSourceId());
        candidate.setFilename(item.getFilename());
        candidate.setFormat(item.getFormat());
        candidate.setBitrateKbps(item.getBitrateKbps() == null ? 0 : item.getBitrateKbps());
        candidate.setLengthSeconds(item.getLengthSeconds());
        candidate.setHasFreeCapacity(Boolean.TRUE.equals(item.getHasFreeCapacity()));
        candidate.setQueueDepth(item.getQueueDepth() == null ? 0 : item.getQueueDepth());
        candidate.setBpm(item.getBpm());
        candidate.setMusicalKey(item.getMusicalKey());
        candidate.setSizeBytes(item.getSizeBytes());
        return candidate;
    }
}
