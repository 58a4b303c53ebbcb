package org.devios.shell.command;

import org.devios.shell.ErrorKind;
import org.devios.shell.ShellFixture;
import org.devios.shell.dto.ResultKind;
import org.devios.shell.dto.ResultRecord;
import org.devios.shell.session.Language;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SystemCommandsTest {

    private final ShellFixture shell = ShellFixture.english();

    @AfterEach
    void tearDown() {
        shell.close();
    }

    private static List<String> texts(List<ResultRecord> records) {
        return records.stream().map(ResultRecord::text).toList();
    }

    @Test
    void help_restrictedListsBasicCommandsAndTip() {
        List<ResultRecord> records = shell.run("help");

        assertThat(records).hasSize(15);
        assertThat(records.get(0).text()).isEqualTo("=== Basic Command List ===");
        assertThat(records.get(14).kind()).isEqualTo(ResultKind.INFO);
        assertThat(texts(records)).noneMatch(text -> text.startsWith("sudo"));
        assertThat(texts(records)).contains("deviser start - Start deviser service");
    }

    @Test
    void help_fullListsEveryCommandAndShortcuts() {
        shell.unlock();

        List<ResultRecord> records = shell.run("help");

        assertThat(records).hasSize(27);
        assertThat(records.get(0).text()).isEqualTo("=== Available Commands ===");
        assertThat(texts(records)).anyMatch(text -> text.startsWith("sudo [cmd]"));
        assertThat(texts(records)).contains("Keyboard shortcuts:", "Ctrl+D        - Logout (when input is empty)");
    }

    @Test
    void whoamiAndId_reflectActor() {
        assertThat(texts(shell.run("whoami"))).containsExactly("user");

        shell.unlock();

        assertThat(texts(shell.run("whoami"))).containsExactly("deviser");
        assertThat(texts(shell.run("id"))).containsExactly("uid=1000(deviser) gid=1000(users) groups=users");
    }

    @Test
    void dateAndUname_useClockAndLanguage() {
        assertThat(texts(shell.run("date"))).containsExactly("1/2/2024, 3:04:05 AM");
        assertThat(texts(shell.run("uname"))).containsExactly("DeviOS");
        assertThat(texts(shell.run("uname -s"))).containsExactly("DeviOS");
        assertThat(texts(shell.run("uname -a")))
                .containsExactly("DeviOS 1.0.0 #1 SMP 1/2/2024, 3:04:05 AM x86_64 Personal Website Terminal");
        assertThat(shell.run("uname -x")).singleElement().satisfies(record -> {
            assertThat(record.errorKind()).isEqualTo(ErrorKind.INVALID_ARGUMENT);
            assertThat(record.text()).isEqualTo("uname: invalid option -- '-x'");
        });
    }

    @Test
    void echo_joinsArguments() {
        assertThat(texts(shell.run("echo hello   world"))).containsExactly("hello world");
        assertThat(texts(shell.run("echo"))).containsExactly("");
    }

    @Test
    void man_coversLsAndCdOnly() {
        shell.unlock();

        assertThat(shell.run("man cd").get(0).text()).startsWith("CD(1)");
        assertThat(texts(shell.run("man ls"))).isEqualTo(texts(shell.run("ls --help")));
        assertThat(shell.run("man")).singleElement().satisfies(record -> {
            assertThat(record.errorKind()).isEqualTo(ErrorKind.INVALID_ARGUMENT);
            assertThat(record.text()).isEqualTo("What manual page do you want?");
        });
        assertThat(texts(shell.run("man grep"))).containsExactly("No manual entry for grep");
    }

    @Test
    void lang_withoutArgumentShowsCurrentAndUsage() {
        assertThat(texts(shell.run("lang"))).containsExactly("Current language: English", "Usage: lang [zh|en]");
    }

    @Test
    void lang_invalidValueAddsUsageHint() {
        List<ResultRecord> records = shell.run("lang fr");

        assertThat(records).extracting(ResultRecord::kind).containsExactly(ResultKind.ERROR, ResultKind.INFO);
        assertThat(records.get(0).errorKind()).isEqualTo(ErrorKind.INVALID_ARGUMENT);
        assertThat(texts(records)).containsExactly("Invalid option -- 'fr'", "Usage: lang [zh|en]");
        assertThat(shell.session.language()).isEqualTo(Language.EN_US);
    }

    @Test
    void lang_switchReplacesTranscriptWithBanner() {
        assertThat(texts(shell.run("lang zh"))).containsExactly("語言已切換為中文");
        assertThat(shell.session.language()).isEqualTo(Language.ZH_TW);

        shell.awaitIdle();

        assertThat(shell.engine.transcript()).singleElement().satisfies(entry -> {
            assertThat(entry.command()).isEmpty();
            assertThat(entry.records()).extracting(ResultRecord::kind).containsExactly(ResultKind.SYSTEM, ResultKind.INFO);
            assertThat(entry.records().get(0).text()).isEqualTo("語言已切換為中文");
        });
        assertThat(texts(shell.run("lang en"))).containsExactly("Language changed to English");
    }

    @Test
    void theme_togglesPreference() {
        assertThat(shell.session.isDarkTheme()).isTrue();

        assertThat(texts(shell.run("theme"))).containsExactly("Theme changed");
        assertThat(shell.session.isDarkTheme()).isFalse();
    }

    @Test
    void clear_emptiesTranscriptWithoutAddingEntry() {
        shell.run("echo one");

        assertThat(shell.run("clear")).isEmpty();
        assertThat(shell.engine.transcript()).isEmpty();
    }

    @Test
    void exit_logsOutAndResetsSession() {
        shell.unlock();
        shell.run("cd about");
        shell.run("theme");

        List<ResultRecord> records = shell.run("exit");

        assertThat(records).extracting(ResultRecord::kind).containsExactly(ResultKind.LOGOUT, ResultKind.LOGOUT);
        assertThat(records.get(0).text()).isEqualTo("logout");
        assertThat(shell.session.actor()).isEqualTo("user");
        assertThat(shell.session.isFullFeatured()).isFalse();
        assertThat(shell.session.cwd()).isEqualTo("~");
        assertThat(shell.session.history()).isEmpty();
        assertThat(shell.session.isDarkTheme()).isFalse();

        shell.awaitIdle();

        assertThat(shell.engine.transcript()).singleElement().satisfies(entry -> assertThat(texts(entry.records()))
                .containsExactly("Welcome back to the Linux-style terminal portfolio!",
                        "Type \"help\" to see available commands."));
    }

    @Test
    void portfolioSections_pointToTheirDirectory() {
        shell.unlock();

        assertThat(texts(shell.run("about"))).containsExactly(
                "Switch to about directory to see more information", "Use \"cd about\" command");

        shell.run("cd skills");

        assertThat(texts(shell.run("skills"))).containsExactly(
                "====== Skills ======",
                "Please use \"ls\" to see available files, and \"cat [filename]\" to read content",
                "Example: cat frontend.txt");
    }

    @Test
    void github_printsProfileSummary() {
        shell.unlock();

        List<ResultRecord> records = shell.run("github");

        assertThat(records).hasSize(11);
        assertThat(records.get(0).text()).isEqualTo("====== GitHub Info ======");
        assertThat(records.get(10).kind()).isEqualTo(ResultKind.SYSTEM);
    }

    @Test
    void deviser_onlyAcceptsStartAndRunsOnce() {
        assertThat(shell.run("deviser")).singleElement().satisfies(record -> {
            assertThat(record.errorKind()).isEqualTo(ErrorKind.INVALID_ARGUMENT);
            assertThat(record.text()).isEqualTo("Usage: deviser start");
        });
        assertThat(shell.run("deviser stop")).singleElement()
                .satisfies(record -> assertThat(record.errorKind()).isEqualTo(ErrorKind.INVALID_ARGUMENT));

        shell.unlock();

        assertThat(texts(shell.run("deviser START"))).containsExactly("deviser service is already running!");
    }
}
