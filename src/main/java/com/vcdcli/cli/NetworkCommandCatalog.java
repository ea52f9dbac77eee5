package com.vcdcli.cli;

import com.vcdcli.dto.request.DeleteNetworkRequest;
import com.vcdcli.dto.request.DhcpSpec;
import com.vcdcli.dto.request.DirectNetworkSpec;
import com.vcdcli.dto.request.ExternalNetworkSpec;
import com.vcdcli.dto.request.ExternalNetworkUpdate;
import com.vcdcli.dto.request.IsolatedNetworkSpec;
import com.vcdcli.exception.CommandFailedException;
import com.vcdcli.exception.ErrorKind;
import com.vcdcli.service.api.NetworkOperationInvoker;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.shell.command.CommandContext;
import org.springframework.shell.command.CommandParser.CommandParserResult;
import org.springframework.shell.command.CommandRegistration;
import org.springframework.shell.command.CommandRegistration.OptionArity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * The {@code network} command tree, declared as a fixed table of Spring Shell registrations:
 * <pre>
 * network external {create, list, delete, update}
 * network direct   {create, list, delete}
 * network isolated {create, list, delete}
 * </pre>
 * Each leaf declares its own options and hands the parsed values to one
 * {@link NetworkOperationInvoker} method. Failed outcomes are resolved by
 * {@link CommandFailureResolver}.
 */
@Configuration
public class NetworkCommandCatalog {

    public static final String GROUP = "Network Commands";

    private final NetworkOperationInvoker invoker;
    private final OutcomeRenderer renderer;
    private final CommandFailureResolver failureResolver;

    public NetworkCommandCatalog(NetworkOperationInvoker invoker,
                                 OutcomeRenderer renderer,
                                 CommandFailureResolver failureResolver) {
        this.invoker = invoker;
        this.renderer = renderer;
        this.failureResolver = failureResolver;
    }

    // --- network external ---

    @Bean
    public CommandRegistration networkExternalCreate() {
        return CommandRegistration.builder()
                .command("network", "external", "create")
                .group(GROUP)
                .description("create a new external network (system administrators only)")
                .withOption().longNames("name").label("<name>").position(0).arity(OptionArity.EXACTLY_ONE).required()
                    .description("Name of the external network").and()
                .withOption().longNames("vc-name").label("<vc-name>").position(1).arity(OptionArity.EXACTLY_ONE).required()
                    .description("Name of the vCenter server backing the network").and()
                .withOption().longNames("port-group").shortNames('p').type(String[].class).arity(OptionArity.ONE_OR_MORE)
                    .description("Port group(s) backing the network; at least one is required").and()
                .withOption().longNames("gateway").shortNames('g').required()
                    .description("Gateway IP of the subnet").and()
                .withOption().longNames("netmask").shortNames('n').required()
                    .description("Network mask of the subnet").and()
                .withOption().longNames("ip-range").shortNames('i').type(String[].class).arity(OptionArity.ONE_OR_MORE)
                    .description("IP range(s) in StartAddress-EndAddress format; at least one is required").and()
                .withOption().longNames("description").shortNames('d')
                    .description("Description of the external network").and()
                .withOption().longNames("dns1").description("IP of the primary DNS server of the subnet").and()
                .withOption().longNames("dns2").description("IP of the secondary DNS server of the subnet").and()
                .withOption().longNames("dns-suffix").description("DNS suffix").and()
                .withTarget().function(ctx -> renderer.render(invoker.createExternalNetwork(new ExternalNetworkSpec(
                        ctx.getOptionValue("name"),
                        ctx.getOptionValue("vc-name"),
                        values(ctx, "port-group"),
                        ctx.getOptionValue("gateway"),
                        ctx.getOptionValue("netmask"),
                        values(ctx, "ip-range"),
                        textOrEmpty(ctx, "description"),
                        ctx.getOptionValue("dns1"),
                        ctx.getOptionValue("dns2"),
                        ctx.getOptionValue("dns-suffix"))))).and()
                .withErrorHandling().resolver(failureResolver).and()
                .build();
    }

    @Bean
    public CommandRegistration networkExternalList() {
        return CommandRegistration.builder()
                .command("network", "external", "list")
                .group(GROUP)
                .description("list all external networks in the system")
                .withTarget().function(ctx -> renderer.render(invoker.listExternalNetworks())).and()
                .withErrorHandling().resolver(failureResolver).and()
                .build();
    }

    @Bean
    public CommandRegistration networkExternalDelete() {
        return CommandRegistration.builder()
                .command("network", "external", "delete")
                .group(GROUP)
                .description("delete an external network")
                .withOption().longNames("name").label("<name>").position(0).arity(OptionArity.EXACTLY_ONE).required()
                    .description("Name of the external network").and()
                .withOption().longNames("yes").shortNames('y').type(boolean.class).defaultValue("false")
                    .description("Delete without asking for confirmation").and()
                .withTarget().function(ctx -> renderer.render(invoker.deleteExternalNetwork(
                        new DeleteNetworkRequest(ctx.getOptionValue("name"), false, flag(ctx, "yes"))))).and()
                .withErrorHandling().resolver(failureResolver).and()
                .build();
    }

    @Bean
    public CommandRegistration networkExternalUpdate() {
        return CommandRegistration.builder()
                .command("network", "external", "update")
                .group(GROUP)
                .description("update name and description of an external network")
                .withOption().longNames("network").label("<name>").position(0).arity(OptionArity.EXACTLY_ONE).required()
                    .description("Current name of the external network").and()
                .withOption().longNames("name").shortNames('n')
                    .description("New name of the external network").and()
                .withOption().longNames("description").shortNames('d')
                    .description("New description of the external network").and()
                .withTarget().function(ctx -> renderer.render(invoker.updateExternalNetwork(new ExternalNetworkUpdate(
                        ctx.getOptionValue("network"),
                        ctx.getOptionValue("name"),
                        ctx.getOptionValue("description"))))).and()
                .withErrorHandling().resolver(failureResolver).and()
                .build();
    }

    // --- network direct ---

    @Bean
    public CommandRegistration networkDirectCreate() {
        return CommandRegistration.builder()
                .command("network", "direct", "create")
                .group(GROUP)
                .description("create a new directly connected org vdc network in the selected vdc")
                .withOption().longNames("name").label("<name>").position(0).arity(OptionArity.EXACTLY_ONE).required()
                    .description("Name of the org vdc network").and()
                .withOption().longNames("parent").shortNames('p').label("<external network name>").required()
                    .description("Name of the external network to be connected to").and()
                .withOption().longNames("description").shortNames('d')
                    .description("Description of the network to be created").and()
                .withOption().longNames("shared").shortNames('s').type(boolean.class).defaultValue("false")
                    .description("Share the network with other VDC(s) in the organization").and()
                .withOption().longNames("not-shared").shortNames('n').type(boolean.class).defaultValue("false")
                    .description("Don't share the network with other VDC(s) in the organization (default)").and()
                .withTarget().function(ctx -> renderer.render(invoker.createDirectNetwork(new DirectNetworkSpec(
                        ctx.getOptionValue("name"),
                        ctx.getOptionValue("parent"),
                        textOrEmpty(ctx, "description"),
                        pairedFlag(ctx, "shared", "not-shared"))))).and()
                .withErrorHandling().resolver(failureResolver).and()
                .build();
    }

    @Bean
    public CommandRegistration networkDirectList() {
        return CommandRegistration.builder()
                .command("network", "direct", "list")
                .group(GROUP)
                .description("list all directly connected org vdc networks in the selected vdc")
                .withTarget().function(ctx -> renderer.render(invoker.listDirectNetworks())).and()
                .withErrorHandling().resolver(failureResolver).and()
                .build();
    }

    @Bean
    public CommandRegistration networkDirectDelete() {
        return CommandRegistration.builder()
                .command("network", "direct", "delete")
                .group(GROUP)
                .description("delete a directly connected org vdc network in the selected vdc")
                .withOption().longNames("name").label("<name>").position(0).arity(OptionArity.EXACTLY_ONE).required()
                    .description("Name of the org vdc network").and()
                .withOption().longNames("force").shortNames('f').type(boolean.class).defaultValue("false")
                    .description("Force delete the org vdc network even if it is in use").and()
                .withOption().longNames("yes").shortNames('y').type(boolean.class).defaultValue("false")
                    .description("Delete without asking for confirmation").and()
                .withTarget().function(ctx -> renderer.render(invoker.deleteDirectNetwork(new DeleteNetworkRequest(
                        ctx.getOptionValue("name"), flag(ctx, "force"), flag(ctx, "yes"))))).and()
                .withErrorHandling().resolver(failureResolver).and()
                .build();
    }

    // --- network isolated ---

    @Bean
    public CommandRegistration networkIsolatedCreate() {
        return CommandRegistration.builder()
                .command("network", "isolated", "create")
                .group(GROUP)
                .description("create a new isolated org vdc network in the selected vdc")
                .withOption().longNames("name").label("<name>").position(0).arity(OptionArity.EXACTLY_ONE).required()
                    .description("Name of the org vdc network").and()
                .withOption().longNames("gateway").shortNames('g').label("<ip>").required()
                    .description("IP address of the gateway of the new network").and()
                .withOption().longNames("netmask").shortNames('n').label("<netmask>").required()
                    .description("Network mask for the gateway").and()
                .withOption().longNames("description").shortNames('d')
                    .description("Description of the network to be created").and()
                .withOption().longNames("dns1").label("<ip>").description("IP of the primary DNS server").and()
                .withOption().longNames("dns2").label("<ip>").description("IP of the secondary DNS server").and()
                .withOption().longNames("dns-suffix").label("<name>").description("DNS suffix").and()
                .withOption().longNames("ip-range-start").label("<ip>")
                    .description("Start address of the IP range used for static pool allocation").and()
                .withOption().longNames("ip-range-end").label("<ip>")
                    .description("End address of the IP range used for static pool allocation").and()
                .withOption().longNames("dhcp-enabled").type(boolean.class).defaultValue("false")
                    .description("Enable the DHCP service on the new network").and()
                .withOption().longNames("dhcp-disabled").type(boolean.class).defaultValue("false")
                    .description("Disable the DHCP service on the new network (default)").and()
                .withOption().longNames("default-lease-time").type(Integer.class).label("<seconds>")
                    .description("Default lease in seconds for DHCP addresses").and()
                .withOption().longNames("max-lease-time").type(Integer.class).label("<seconds>")
                    .description("Max lease in seconds for DHCP addresses").and()
                .withOption().longNames("dhcp-ip-range-start").label("<ip>")
                    .description("Start address of the IP range used for DHCP addresses").and()
                .withOption().longNames("dhcp-ip-range-end").label("<ip>")
                    .description("End address of the IP range used for DHCP addresses").and()
                .withOption().longNames("shared").type(boolean.class).defaultValue("false")
                    .description("Share the network with other VDC(s) in the organization").and()
                .withOption().longNames("not-shared").type(boolean.class).defaultValue("false")
                    .description("Don't share the network with other VDC(s) in the organization (default)").and()
                .withTarget().function(ctx -> renderer.render(invoker.createIsolatedNetwork(isolatedNetworkSpec(ctx)))).and()
                .withErrorHandling().resolver(failureResolver).and()
                .build();
    }

    @Bean
    public CommandRegistration networkIsolatedList() {
        return CommandRegistration.builder()
                .command("network", "isolated", "list")
                .group(GROUP)
                .description("list all isolated org vdc networks in the selected vdc")
                .withTarget().function(ctx -> renderer.render(invoker.listIsolatedNetworks())).and()
                .withErrorHandling().resolver(failureResolver).and()
                .build();
    }

    @Bean
    public CommandRegistration networkIsolatedDelete() {
        return CommandRegistration.builder()
                .command("network", "isolated", "delete")
                .group(GROUP)
                .description("delete an isolated org vdc network in the selected vdc")
                .withOption().longNames("name").label("<name>").position(0).arity(OptionArity.EXACTLY_ONE).required()
                    .description("Name of the org vdc network").and()
                .withOption().longNames("force").shortNames('f').type(boolean.class).defaultValue("false")
                    .description("Force delete the org vdc network even if it is in use").and()
                .withOption().longNames("yes").shortNames('y').type(boolean.class).defaultValue("false")
                    .description("Delete without asking for confirmation").and()
                .withTarget().function(ctx -> renderer.render(invoker.deleteIsolatedNetwork(new DeleteNetworkRequest(
                        ctx.getOptionValue("name"), flag(ctx, "force"), flag(ctx, "yes"))))).and()
                .withErrorHandling().resolver(failureResolver).and()
                .build();
    }

    private static IsolatedNetworkSpec isolatedNetworkSpec(CommandContext ctx) {
        boolean shared = pairedFlag(ctx, "shared", "not-shared");
        DhcpSpec dhcp = null;
        if (pairedFlag(ctx, "dhcp-enabled", "dhcp-disabled")) {
            dhcp = new DhcpSpec(true,
                    ctx.getOptionValue("default-lease-time"),
                    ctx.getOptionValue("max-lease-time"),
                    ctx.getOptionValue("dhcp-ip-range-start"),
                    ctx.getOptionValue("dhcp-ip-range-end"));
        }
        return new IsolatedNetworkSpec(
                ctx.getOptionValue("name"),
                ctx.getOptionValue("gateway"),
                ctx.getOptionValue("netmask"),
                textOrEmpty(ctx, "description"),
                ctx.getOptionValue("dns1"),
                ctx.getOptionValue("dns2"),
                ctx.getOptionValue("dns-suffix"),
                ctx.getOptionValue("ip-range-start"),
                ctx.getOptionValue("ip-range-end"),
                dhcp,
                shared);
    }

    /**
     * Collects every value of a repeatable option. Spring Shell keeps one parser result per
     * occurrence, so {@code -p a -p b} and {@code -p a b} both give {@code [a, b]}.
     */
    static List<String> values(CommandContext ctx, String option) {
        List<String> values = new ArrayList<>();
        for (CommandParserResult result : ctx.getParserResults().results()) {
            if (Arrays.asList(result.option().getLongNames()).contains(option)) {
                addValues(values, result.value());
            }
        }
        return values;
    }

    private static void addValues(List<String> values, Object value) {
        if (value == null) {
            return;
        }
        if (value instanceof String[] array) {
            values.addAll(Arrays.asList(array));
        } else if (value instanceof Collection<?> collection) {
            collection.forEach(element -> values.add(String.valueOf(element)));
        } else {
            values.add(value.toString());
        }
    }

    static String textOrEmpty(CommandContext ctx, String option) {
        String value = ctx.getOptionValue(option);
        return value != null ? value : "";
    }

    static boolean flag(CommandContext ctx, String option) {
        Object value = ctx.getOptionValue(option);
        if (value instanceof Boolean bool) {
            return bool;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    /**
     * Reads an on/off flag pair such as {@code --shared/--not-shared}; the pair defaults to off.
     */
    static boolean pairedFlag(CommandContext ctx, String on, String off) {
        boolean onSet = flag(ctx, on);
        if (onSet && flag(ctx, off)) {
            throw new CommandFailedException(ErrorKind.VALIDATION,
                    "Options '--" + on + "' and '--" + off + "' cannot be used together.");
        }
        return onSet;
    }
}
