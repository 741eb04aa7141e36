package com.keg.roster.api;

import com.keg.roster.auth.ExecutiveRole;
import com.keg.roster.auth.RequiresExecutiveRole;
import com.keg.roster.infrastructure.web.AuthenticationInterceptor;
import com.keg.roster.member.Member;
import com.keg.roster.member.MemberCache;
import com.keg.roster.member.MemberNotFoundException;
import com.keg.roster.sync.SynchronizationScheduler;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/members")
public class MembersController {

    private final MemberCache cache;
    private final SynchronizationScheduler scheduler;

    public MembersController(MemberCache cache, SynchronizationScheduler scheduler) {
        this.cache = cache;
        this.scheduler = scheduler;
    }

    /**
     * The crew. Contact data is included only for authenticated callers.
     */
    @GetMapping
    public CrewView crew(
            @RequestAttribute(name = AuthenticationInterceptor.MEMBER_ATTRIBUTE, required = false) Member caller) {
        boolean sensitive = caller != null;
        return cache.read(view -> CrewView.of(view, sensitive));
    }

    @GetMapping("/{username}/photo")
    public ResponseEntity<byte[]> photo(@PathVariable String username) {
        Member member = cache.find(username).orElseThrow(() -> new MemberNotFoundException(username));
        if (!member.hasPhoto()) {
            throw new MemberNotFoundException(username);
        }
        return ResponseEntity.ok().contentType(MediaType.IMAGE_JPEG).body(member.photo());
    }

    @PostMapping("/synchronize")
    @RequiresExecutiveRole(ExecutiveRole.ROSTER)
    public ResponseEntity<Void> synchronize() {
        scheduler.triggerNow();
        return ResponseEntity.accepted().build();
    }
}
