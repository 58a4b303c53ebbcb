package org.devios.shell.command;

import org.devios.shell.ErrorKind;
import org.devios.shell.ShellFixture;
import org.devios.shell.dto.ExecuteResult;
import org.devios.shell.dto.ResultKind;
import org.devios.shell.dto.ResultRecord;
import org.devios.shell.dto.TranscriptEntry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuthCommandsTest {

    private final ShellFixture shell = ShellFixture.english();

    @BeforeEach
    void setUp() {
        shell.unlock();
    }

    @AfterEach
    void tearDown() {
        shell.close();
    }

    @Test
    void sudo_promptsForSecretOfCurrentActor() {
        ExecuteResult result = shell.engine.submit("sudo ls -la");

        assertThat(result.command()).isEqualTo("sudo ls -la");
        assertThat(result.records()).singleElement().satisfies(record -> {
            assertThat(record.kind()).isEqualTo(ResultKind.SYSTEM);
            assertThat(record.text()).isEqualTo("[sudo] password for deviser:");
        });
        assertThat(result.awaitingSecret()).isTrue();
        assertThat(shell.session.authChallenge()).hasValueSatisfying(challenge -> {
            assertThat(challenge.pendingCommand()).isEqualTo("ls -la");
            assertThat(challenge.attempts()).isZero();
        });
    }

    @Test
    void sudo_withoutCommandIsInvalid() {
        assertThat(shell.run("sudo")).singleElement().satisfies(record -> {
            assertThat(record.errorKind()).isEqualTo(ErrorKind.INVALID_ARGUMENT);
            assertThat(record.text()).isEqualTo("sudo: missing command to run");
        });
        assertThat(shell.session.isAwaitingSecret()).isFalse();
    }

    @Test
    void correctSecret_elevatesAndRunsPendingCommand() {
        shell.run("sudo whoami");

        ExecuteResult result = shell.engine.submit("password");

        assertThat(result.command()).isEmpty();
        assertThat(result.records()).extracting(ResultRecord::text).containsExactly("", "root");
        assertThat(result.records().get(0).kind()).isEqualTo(ResultKind.SYSTEM);
        assertThat(result.promptAfter()).isEqualTo("root@terminal:~$");
        assertThat(result.awaitingSecret()).isFalse();
        assertThat(shell.session.isPrivileged()).isTrue();
        assertThat(shell.run("id")).extracting(ResultRecord::text)
                .containsExactly("uid=0(root) gid=1000(users) groups=users");
    }

    @Test
    void secret_isTrimmedBeforeComparison() {
        shell.run("sudo whoami");

        assertThat(shell.run("  password  ")).extracting(ResultRecord::text).containsExactly("", "root");
    }

    @Test
    void secret_isNeitherEchoedNorRemembered() {
        shell.run("sudo whoami");
        shell.run("hunter2");
        shell.run("password");

        assertThat(shell.session.history()).containsExactly("deviser start", "sudo whoami");
        List<TranscriptEntry> entries = shell.engine.transcript();
        assertThat(entries).extracting(TranscriptEntry::command).doesNotContain("hunter2", "password");
    }

    @Test
    void wrongSecret_keepsWaiting() {
        shell.run("sudo whoami");

        assertThat(shell.run("wrong")).singleElement().satisfies(record -> {
            assertThat(record.errorKind()).isEqualTo(ErrorKind.AUTH_FAILURE);
            assertThat(record.text()).isEqualTo("sudo: Authentication failure");
        });
        assertThat(shell.session.isAwaitingSecret()).isTrue();
        assertThat(shell.session.authChallenge().orElseThrow().attempts()).isEqualTo(1);
        assertThat(shell.session.isPrivileged()).isFalse();
    }

    @Test
    void thirdFailure_locksOutAndDropsPendingCommand() {
        shell.run("sudo whoami");
        shell.run("one");
        shell.run("two");

        assertThat(shell.run("three")).singleElement().satisfies(record -> {
            assertThat(record.errorKind()).isEqualTo(ErrorKind.AUTH_LOCKOUT);
            assertThat(record.text()).isEqualTo("sudo: 3 incorrect password attempts");
        });
        assertThat(shell.session.isAwaitingSecret()).isFalse();

        // 锁定后再输入正确密码，只会被当作普通命令
        assertThat(shell.run("password")).singleElement()
                .satisfies(record -> assertThat(record.errorKind()).isEqualTo(ErrorKind.COMMAND_NOT_FOUND));
        assertThat(shell.session.isPrivileged()).isFalse();
        assertThat(shell.engine.prompt()).isEqualTo("deviser@terminal:~$");
    }

    @Test
    void sudo_whilePrivilegedRunsImmediately() {
        shell.run("sudo whoami");
        shell.run("password");

        assertThat(shell.run("sudo pwd")).extracting(ResultRecord::text).containsExactly("/home/deviser");
        assertThat(shell.session.isAwaitingSecret()).isFalse();
    }

    @Test
    void sudo_pendingCommandFailureIsReportedAfterElevation() {
        shell.run("sudo cat nothing.txt");

        List<ResultRecord> records = shell.run("password");

        assertThat(records).extracting(ResultRecord::kind).containsExactly(ResultKind.SYSTEM, ResultKind.ERROR);
        assertThat(records.get(1).errorKind()).isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(shell.session.isPrivileged()).isTrue();
    }

    @Test
    void interrupt_keepsPendingChallengeAndHidesInput() {
        shell.run("sudo whoami");

        List<ResultRecord> records = shell.engine.interrupt("pass");

        assertThat(records).singleElement().satisfies(record -> {
            assertThat(record.errorKind()).isEqualTo(ErrorKind.INTERRUPTED);
            assertThat(record.text()).isEqualTo("^C");
        });
        assertThat(shell.session.isAwaitingSecret()).isTrue();
        assertThat(shell.engine.transcript()).last()
                .satisfies(entry -> assertThat(entry.command()).isEmpty());

        assertThat(shell.run("password")).extracting(ResultRecord::text).containsExactly("", "root");
    }

    @Test
    void logout_dropsElevation() {
        shell.run("sudo whoami");
        shell.run("password");

        shell.run("logout");

        assertThat(shell.session.isPrivileged()).isFalse();
        assertThat(shell.session.actor()).isEqualTo("user");
    }

    @Test
    void constructor_rejectsUnusableSettings() {
        assertThatThrownBy(() -> new AuthCommands("", 3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AuthCommands("secret", 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
