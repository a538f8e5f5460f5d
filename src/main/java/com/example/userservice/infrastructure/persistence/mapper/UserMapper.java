package com.example.userservice.infrastructure.persistence.mapper;

import com.example.userservice.infrastructure.persistence.entity.UserEntity;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface UserMapper {

    @Insert("INSERT INTO users(id, name, email, age) VALUES(#{id}, #{name}, #{email}, #{age})")
    int insert(UserEntity entity);

    @Select("SELECT id, name, email, age, created_at, updated_at FROM users WHERE id = #{id}")
    UserEntity selectById(@Param("id") String id);

    @Update("UPDATE users SET name = #{name}, email = #{email}, age = #{age}, updated_at = CURRENT_TIMESTAMP "
            + "WHERE id = #{id}")
    int update(UserEntity entity);

    @Delete("DELETE FROM users WHERE id = #{id}")
    int deleteById(@Param("id") String id);
}
