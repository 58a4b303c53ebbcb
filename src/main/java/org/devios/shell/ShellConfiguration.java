package org.devios.shell;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.devios.shell.command.Choreography;
import org.devios.shell.command.CommandDispatcher;
import org.devios.shell.command.ShellEnvironment;
import org.devios.shell.fs.FileTreeLoader;
import org.devios.shell.fs.PathResolver;
import org.devios.shell.fs.PermissionEvaluator;
import org.devios.shell.fs.VirtualFileTree;
import org.devios.shell.sequencer.ScriptedSequencer;
import org.devios.shell.sequencer.Transcript;
import org.devios.shell.session.FeatureGate;
import org.devios.shell.session.ShellSession;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.MessageSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.support.ResourceBundleMessageSource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 虚拟终端的 Bean 装配。
 * <p>
 * 说明：
 * <ul>
 *   <li>核心类都是普通 Java 对象，这里只负责把 {@link ShellProperties} 传进去。</li>
 *   <li>文件树在启动时从 {@code app.shell.tree-location} 一次性加载，格式错误直接让启动失败。</li>
 *   <li>脚本调度器是单线程的，容器关闭时一并停止。</li>
 * </ul>
 */
@Configuration(proxyBeanMethods = false)
public class ShellConfiguration {

    @Bean
    public Clock shellClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public MessageSource messageSource() {
        ResourceBundleMessageSource messageSource = new ResourceBundleMessageSource();
        messageSource.setBasename("messages");
        messageSource.setDefaultEncoding(StandardCharsets.UTF_8.name());
        messageSource.setFallbackToSystemLocale(false);
        return messageSource;
    }

    @Bean
    public ShellMessages shellMessages(MessageSource messageSource) {
        return new ShellMessages(messageSource);
    }

    @Bean
    public VirtualFileTree virtualFileTree(ShellProperties properties, ResourceLoader resourceLoader,
                                           ObjectProvider<ObjectMapper> objectMapper, Clock shellClock) {
        FileTreeLoader loader = new FileTreeLoader(objectMapper.getIfAvailable(ObjectMapper::new), shellClock);
        Resource resource = resourceLoader.getResource(properties.getTreeLocation());
        try (InputStream in = resource.getInputStream()) {
            return loader.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("无法读取文件树：" + properties.getTreeLocation(), e);
        }
    }

    @Bean
    public PathResolver pathResolver(VirtualFileTree tree) {
        return new PathResolver(tree);
    }

    @Bean
    public PermissionEvaluator permissionEvaluator() {
        return new PermissionEvaluator();
    }

    @Bean
    public FeatureGate featureGate(ShellProperties properties) {
        return new FeatureGate(new LinkedHashSet<>(properties.getGatedNames()),
                new LinkedHashSet<>(properties.getBasicCommands()));
    }

    @Bean(destroyMethod = "shutdown")
    public ScriptedSequencer scriptedSequencer() {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "shell-sequencer");
            thread.setDaemon(true);
            return thread;
        });
        return new ScriptedSequencer(scheduler);
    }

    @Bean
    public Transcript transcript() {
        return new Transcript();
    }

    @Bean
    public ShellSession shellSession(ShellProperties properties) {
        return new ShellSession(properties.getInitialUser(), new LinkedHashSet<>(properties.getGroups()),
                properties.getDefaultLanguage());
    }

    @Bean
    public Choreography choreography(ShellMessages messages, ShellProperties properties, Clock shellClock) {
        return new Choreography(messages, properties, shellClock);
    }

    @Bean
    public CommandDispatcher commandDispatcher(VirtualFileTree tree, PathResolver resolver,
                                               PermissionEvaluator permissions, FeatureGate gate,
                                               ShellMessages messages, ShellProperties properties,
                                               Clock shellClock, Choreography choreography) {
        ShellEnvironment environment = new ShellEnvironment(tree, resolver, permissions, gate, messages, properties, shellClock);
        return CommandDispatcher.standard(environment, choreography);
    }

    @Bean
    public ShellEngine shellEngine(ShellSession session, CommandDispatcher dispatcher, Transcript transcript,
                                   ScriptedSequencer sequencer, Choreography choreography, ShellProperties properties) {
        return new ShellEngine(session, dispatcher, transcript, sequencer, choreography, properties.getHostName());
    }
}
