/**
 * ABR state server source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.abrserver.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.abrserver.cli.AbrServerCommand} maps commands to the runtime.</li>
 *   <li>{@code io.abrserver.state.StateStore} owns the canonical document, its history and backups.</li>
 *   <li>{@code io.abrserver.notify.Notifier} fans out notifications and routes inbound messages.</li>
 *   <li>{@code io.abrserver.asset.AssetPipeline} downloads and stores referenced assets.</li>
 * </ul>
 */
package io.abrserver;
