package com.di.ladder.store;

import com.di.ladder.model.Combatant;
import com.di.ladder.model.Tier;
import org.springframework.jdbc.core.RowMapper;

/**
 * Binding for the {@code combatant} table.
 */
public class CombatantRowBinding implements LadderRowBinding<Combatant> {

    private static final RowMapper<Combatant> ROW_MAPPER = (rs, rowNum) -> Combatant.builder()
            .id(rs.getLong("id"))
            .name(rs.getString("name"))
            .tier(Tier.fromKey(rs.getString("tier")))
            .instanceNumber(rs.getInt("instance_number"))
            .points(rs.getInt("points"))
            .rating(rs.getInt("rating"))
            .cyclesInTier(rs.getInt("cycles_in_tier"))
            .placeholder(rs.getBoolean("placeholder"))
            .build();

    @Override
    public RowMapper<Combatant> rowMapper() {
        return ROW_MAPPER;
    }

    @Override
    public Object[] insertParameters(Combatant c) {
        return new Object[]{
                c.getName(), c.getTier().key(), c.getInstanceNumber(), c.getPoints(),
                c.getRating(), c.getCyclesInTier(), c.isPlaceholder()
        };
    }
}
