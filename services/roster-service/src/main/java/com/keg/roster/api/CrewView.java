package com.keg.roster.api;

import com.keg.roster.member.MemberCacheView;
import com.keg.roster.member.RegisterEntry;
import java.util.List;

/**
 * The whole association: musicians grouped by register, sutlers and honorary members.
 */
public record CrewView(List<RegisterView> musicians, List<MemberView> sutlers, List<MemberView> honoraryMembers) {

    /**
     * Builds the view from the cache. Must be called inside {@code MemberCache.read}.
     */
    public static CrewView of(MemberCacheView cache, boolean sensitive) {
        return new CrewView(
                cache.membersByRegister().stream().map(entry -> RegisterView.of(entry, sensitive)).toList(),
                cache.sutlers().stream().map(m -> MemberView.of(m, sensitive)).toList(),
                cache.honoraryMembers().stream().map(m -> MemberView.of(m, sensitive)).toList());
    }

    public record RegisterView(String name, String namePlural, List<MemberView> members) {

        static RegisterView of(RegisterEntry entry, boolean sensitive) {
            return new RegisterView(
                    entry.register().name(),
                    entry.register().namePlural(),
                    entry.members().stream().map(m -> MemberView.of(m, sensitive)).toList());
        }
    }
}
