package com.expensesnap.core.application;

import com.expensesnap.core.IntegrationTestSupport;
import com.expensesnap.core.domain.Company;
import com.expensesnap.core.domain.InviteCode;
import com.expensesnap.core.domain.Role;
import com.expensesnap.core.domain.UserAccount;
import com.expensesnap.core.domain.access.CallerIdentity;
import com.expensesnap.core.exception.AccessDeniedException;
import com.expensesnap.core.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.crypto.password.PasswordEncoder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TeamServiceTest extends IntegrationTestSupport {

    @Autowired
    private TeamService team;

    @Autowired
    private PasswordEncoder encoder;

    private Company acme;
    private Company globex;
    private CallerIdentity superAdmin;
    private UserAccount acmeAdmin;
    private UserAccount acmeMember;
    private UserAccount globexMember;

    @BeforeEach
    void seed() {
        acme = company("Acme", "USD");
        globex = company("Globex", "EUR");
        superAdmin = caller(user("Root", Role.SUPER_ADMIN, null));
        acmeAdmin = user("Ann", Role.COMPANY_ADMIN, acme.getId());
        acmeMember = user("Bob", Role.MEMBER, acme.getId());
        globexMember = user("Gus", Role.MEMBER, globex.getId());
    }

    @Test
    void companyAdminInvitesMembersOfOwnCompanyOnly() {
        InviteCode invite = team.createInvite(caller(acmeAdmin), null, "company_admin");

        assertThat(invite.getCompanyId()).isEqualTo(acme.getId());
        assertThat(invite.getRole()).isEqualTo(Role.MEMBER);
        assertThatThrownBy(() -> team.createInvite(caller(acmeAdmin), globex.getId(), null))
                .isInstanceOf(AccessDeniedException.class);
        assertThatThrownBy(() -> team.createInvite(caller(acmeMember), null, null))
                .isInstanceOf(AccessDeniedException.class);
    }

    @Test
    void superAdminMustNameCompanyAndMayInviteAdmins() {
        assertThatThrownBy(() -> team.createInvite(superAdmin, null, "member"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Select a company");

        assertThat(team.createInvite(superAdmin, globex.getId(), "company_admin").getRole())
                .isEqualTo(Role.COMPANY_ADMIN);
        assertThat(team.createInvite(superAdmin, globex.getId(), "super_admin").getRole())
                .isEqualTo(Role.MEMBER);
    }

    @Test
    void teamListingIsScoped() {
        team.createInvite(caller(acmeAdmin), null, null);
        team.createInvite(superAdmin, globex.getId(), null);

        TeamService.TeamOverview acmeTeam = team.team(caller(acmeAdmin), null);

        assertThat(acmeTeam.users()).extracting(UserAccount::getName).containsExactlyInAnyOrder("Ann", "Bob");
        assertThat(acmeTeam.pendingInvites()).hasSize(1);
        assertThat(team.team(superAdmin, null).users()).hasSize(4);
        assertThat(team.team(superAdmin, globex.getId()).users()).extracting(UserAccount::getName).containsOnly("Gus");
    }

    @Test
    void removeMemberRespectsSelfAndTenantRules() {
        assertThatThrownBy(() -> team.removeMember(caller(acmeAdmin), acmeAdmin.getId()))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Cannot remove yourself");
        assertThatThrownBy(() -> team.removeMember(caller(acmeAdmin), globexMember.getId()))
                .isInstanceOf(AccessDeniedException.class);

        team.removeMember(caller(acmeAdmin), acmeMember.getId());

        assertThat(userRepository.findById(acmeMember.getId())).isEmpty();
        assertThat(userRepository.findById(globexMember.getId())).isPresent();
    }

    @Test
    void resetPasswordStoresNewHash() {
        assertThatThrownBy(() -> team.resetPassword(caller(acmeAdmin), acmeMember.getId(), "123"))
                .isInstanceOf(ValidationException.class);

        team.resetPassword(caller(acmeAdmin), acmeMember.getId(), "brand-new-pass");

        String hash = userRepository.findById(acmeMember.getId()).orElseThrow().getPasswordHash();
        assertThat(encoder.matches("brand-new-pass", hash)).isTrue();
        assertThatThrownBy(() -> team.resetPassword(caller(acmeMember), acmeAdmin.getId(), "whatever1"))
                .isInstanceOf(AccessDeniedException.class);
    }
}
