/**
 * ChunkMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.chunkmesh.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.chunkmesh.cli.ChunkMeshCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.chunkmesh.runtime.TransferRuntime} owns sending, frame handling, retries and the inbox.</li>
 *   <li>{@code io.chunkmesh.router.DeliveryRouter} decides relay, reassembly and acknowledgement per frame.</li>
 * </ul>
 */
package io.chunkmesh;
