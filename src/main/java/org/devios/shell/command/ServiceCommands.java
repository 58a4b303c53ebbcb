package org.devios.shell.command;

import org.devios.shell.ErrorKind;
import org.devios.shell.dto.ResultRecord;
import org.devios.shell.session.ShellSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * {@code deviser start}：把会话从受限模式切到完整模式（只切一次，不可逆）。
 */
public class ServiceCommands implements CommandModule {

    private static final Logger log = LoggerFactory.getLogger(ServiceCommands.class);

    private final Choreography choreography;
    private final String serviceUser;

    public ServiceCommands(Choreography choreography, String serviceUser) {
        this.choreography = choreography;
        this.serviceUser = serviceUser;
    }

    @Override
    public void registerInto(Map<CommandName, CommandHandler> registry) {
        registry.put(CommandName.DEVISER, this::deviser);
    }

    CommandOutcome deviser(CommandContext ctx) {
        String action = ctx.line().arg(0);
        if (action == null || !action.equalsIgnoreCase("start")) {
            throw ctx.fail(ErrorKind.INVALID_ARGUMENT, "deviser.usage");
        }
        ShellSession session = ctx.session();
        if (session.isFullFeatured()) {
            return CommandOutcome.of(ResultRecord.info(ctx.text("deviser.already")));
        }
        session.unlockFullFeatures(serviceUser);
        log.info("已切换到完整功能模式，当前用户 {}", serviceUser);
        return choreography.boot(ctx.language());
    }
}
