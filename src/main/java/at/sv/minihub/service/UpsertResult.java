package at.sv.minihub.service;

import at.sv.minihub.model.Device;
import at.sv.minihub.model.Entity;

import java.util.List;

public record UpsertResult(Device device, List<Entity> entities) {
}
