package org.devios.shell.command;

import org.devios.shell.ErrorKind;
import org.devios.shell.ShellFixture;
import org.devios.shell.dto.ResultKind;
import org.devios.shell.dto.ResultRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CommandDispatcherTest {

    private final ShellFixture shell = ShellFixture.english();

    @AfterEach
    void tearDown() {
        shell.close();
    }

    @Test
    void pipe_isRejectedAsUnsupported() {
        List<ResultRecord> records = shell.run("ls | grep about");

        assertThat(records).singleElement().satisfies(record -> {
            assertThat(record.kind()).isEqualTo(ResultKind.ERROR);
            assertThat(record.errorKind()).isEqualTo(ErrorKind.UNSUPPORTED);
            assertThat(record.text()).isEqualTo("Pipes (|) are not supported yet");
        });
    }

    @Test
    void redirect_isRejectedAsUnsupported() {
        shell.unlock();

        assertThat(shell.run("echo hi >> out.txt")).singleElement().satisfies(record -> {
            assertThat(record.errorKind()).isEqualTo(ErrorKind.UNSUPPORTED);
            assertThat(record.text()).isEqualTo("Redirection (> or >>) is not supported yet");
        });
        assertThat(shell.run("echo hi > out.txt")).singleElement()
                .satisfies(record -> assertThat(record.errorKind()).isEqualTo(ErrorKind.UNSUPPORTED));
    }

    @Test
    void restricted_unknownCommandAddsStartHints() {
        List<ResultRecord> records = shell.run("foo");

        assertThat(records).extracting(ResultRecord::kind)
                .containsExactly(ResultKind.ERROR, ResultKind.INFO, ResultKind.INFO);
        assertThat(records.get(0).errorKind()).isEqualTo(ErrorKind.COMMAND_NOT_FOUND);
        assertThat(records).extracting(ResultRecord::text).containsExactly(
                "Unknown command: foo",
                "Tip: Type \"deviser start\" to start deviser service",
                "Type \"help\" to see basic command list");
    }

    @Test
    void restricted_gatedCommandLooksExactlyLikeUnknownCommand() {
        List<ResultRecord> gated = shell.run("sudo");
        List<ResultRecord> unknown = shell.run("sudx");

        assertThat(gated).extracting(ResultRecord::kind)
                .containsExactlyElementsOf(unknown.stream().map(ResultRecord::kind).toList());
        assertThat(gated.get(0).text()).isEqualTo("Unknown command: sudo");
        assertThat(gated.get(0).errorKind()).isEqualTo(unknown.get(0).errorKind());
    }

    @Test
    void full_unknownCommandIsNotFound() {
        shell.unlock();

        assertThat(shell.run("foo")).singleElement().satisfies(record -> {
            assertThat(record.errorKind()).isEqualTo(ErrorKind.COMMAND_NOT_FOUND);
            assertThat(record.text()).isEqualTo("foo: Command not found, type \"help\" to see available commands");
        });
    }

    @Test
    void full_unknownCommandWithOptionIsInvalidOption() {
        shell.unlock();

        assertThat(shell.run("foo -x bar")).singleElement().satisfies(record -> {
            assertThat(record.errorKind()).isEqualTo(ErrorKind.INVALID_ARGUMENT);
            assertThat(record.text()).isEqualTo("foo: Invalid option -- '-x bar'");
        });
    }

    @Test
    void commandNames_areCaseInsensitive() {
        assertThat(shell.run("ECHO Hello")).extracting(ResultRecord::text).containsExactly("Hello");
    }

    @Test
    void recursiveForceDelete_triggersDecoyEvenWhenRestricted() {
        List<ResultRecord> records = shell.run("rm -r -f /");

        assertThat(records).extracting(ResultRecord::text)
                .containsExactly("[user@terminal ~]# rm -rf /*", "Deleting files... please wait");
        assertThat(records).noneMatch(ResultRecord::isError);
    }

    @Test
    void commandLine_recognisesRecursiveForceVariants() {
        assertThat(CommandLine.parse("rm -rf /").isRecursiveForceDelete()).isTrue();
        assertThat(CommandLine.parse("rm -fr x").isRecursiveForceDelete()).isTrue();
        assertThat(CommandLine.parse("rm -Rf x").isRecursiveForceDelete()).isTrue();
        assertThat(CommandLine.parse("rm -f -r x").isRecursiveForceDelete()).isTrue();
        assertThat(CommandLine.parse("rm --recursive --force x").isRecursiveForceDelete()).isTrue();
        assertThat(CommandLine.parse("rm -r x").isRecursiveForceDelete()).isFalse();
        assertThat(CommandLine.parse("rm -f x").isRecursiveForceDelete()).isFalse();
        assertThat(CommandLine.parse("echo -rf").isRecursiveForceDelete()).isFalse();
    }

    @Test
    void commandLine_splitsOnAnyWhitespace() {
        CommandLine line = CommandLine.parse("  cat \t bio.txt   extra ");

        assertThat(line.name()).isEqualTo("cat");
        assertThat(line.args()).containsExactly("bio.txt", "extra");
        assertThat(line.raw()).isEqualTo("cat \t bio.txt   extra");
        assertThat(CommandLine.parse("   ").name()).isEmpty();
    }

    @Test
    void commandName_lookupIgnoresCase() {
        assertThat(CommandName.fromToken("LS")).contains(CommandName.LS);
        assertThat(CommandName.fromToken("Deviser")).contains(CommandName.DEVISER);
        assertThat(CommandName.fromToken("nope")).isEmpty();
    }
}
