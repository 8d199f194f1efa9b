package com.di.ladder.store;

import com.di.ladder.model.TagTeam;
import com.di.ladder.model.Tier;
import org.springframework.jdbc.core.RowMapper;

/**
 * Binding for the {@code tag_team} table. Member ratings are read through a join in the queries.
 */
public class TagTeamRowBinding implements LadderRowBinding<TagTeam> {

    private static final RowMapper<TagTeam> ROW_MAPPER = (rs, rowNum) -> TagTeam.builder()
            .id(rs.getLong("id"))
            .stableId(rs.getLong("stable_id"))
            .activeMemberId(rs.getLong("active_member_id"))
            .reserveMemberId(rs.getLong("reserve_member_id"))
            .tier(Tier.fromKey(rs.getString("tier")))
            .instanceNumber(rs.getInt("instance_number"))
            .points(rs.getInt("points"))
            .activeRating(rs.getInt("active_rating"))
            .reserveRating(rs.getInt("reserve_rating"))
            .cyclesInTier(rs.getInt("cycles_in_tier"))
            .placeholder(rs.getBoolean("placeholder"))
            .build();

    @Override
    public RowMapper<TagTeam> rowMapper() {
        return ROW_MAPPER;
    }

    @Override
    public Object[] insertParameters(TagTeam t) {
        return new Object[]{
                t.getStableId(), t.getActiveMemberId(), t.getReserveMemberId(), t.getTier().key(),
                t.getInstanceNumber(), t.getPoints(), t.getCyclesInTier(), t.isPlaceholder()
        };
    }
}
