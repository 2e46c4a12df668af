package io.github.panghy.pluginproxy.proxy.backend;

/**
 * A file picked by the user.
 *
 * @param fileRef The host file reference resource id; the receiver gets one reference
 * @param path    The path
 * @param name    The display name
 */
public record ChosenFile(int fileRef, String path, String name) {
}
